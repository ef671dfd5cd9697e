package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.Attraction;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.AttractionsAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 景点兜底数据源：每个城市返回同一组典型景点，按评分降序截取。
 */
@Component
@RequiredArgsConstructor
public class StaticAttractionsAdapter implements AttractionsAdapter {

    private static final List<Attraction> TEMPLATE = List.of(
            attraction("Central Museum", "museum", 4.6, "Art and history collections from across the region", false),
            attraction("Historic Old Town", "landmark", 4.5, "Cobbled streets, markets and centuries-old architecture", false),
            attraction("Royal Palace", "tourist_attraction", 4.7, "Former royal residence with formal gardens", false),
            attraction("City Cathedral", "landmark", 4.4, "Gothic cathedral with panoramic bell tower", false),
            attraction("Crystal Lake National Park", "national_park", 4.8, "Hiking trails around a glacial lake, rich in wildlife", true),
            attraction("Sunset Beach", "beach", 4.5, "Sandy beach known for swimming and sunset views", true),
            attraction("Modern Art Gallery", "museum", 4.3, "Contemporary exhibitions and sculpture garden", false),
            attraction("Ancient Temple", "tourist_attraction", 4.8, "Ancient temple complex with guided tours", false)
    );

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<List<Attraction>> attractions(String destination, int limit) {
        int n = limit <= 0 ? TEMPLATE.size() : Math.min(limit, TEMPLATE.size());
        String key = CacheClient.buildKey(RedisConstants.CACHE_ATTRACTIONS_KEY, destination, n);
        List<Attraction> list = cacheClient.queryWithPassThrough(key, new TypeReference<List<Attraction>>() {
                }, () -> TEMPLATE.stream()
                        .sorted(Comparator.comparing(Attraction::getRating).reversed())
                        .limit(n)
                        .map(StaticAttractionsAdapter::copy)
                        .toList(),
                RedisConstants.CACHE_ATTRACTIONS_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(list);
    }

    private static Attraction attraction(String name, String type, double rating, String description, boolean natural) {
        return Attraction.builder()
                .name(name)
                .type(type)
                .rating(rating)
                .description(description)
                .natural(natural)
                .build();
    }

    private static Attraction copy(Attraction a) {
        return attraction(a.getName(), a.getType(), a.getRating(), a.getDescription(), a.isNatural());
    }
}
