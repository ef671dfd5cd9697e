package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.category.HotelOffer;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.HotelsAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 酒店兜底数据源。
 */
@Component
@RequiredArgsConstructor
public class StaticHotelsAdapter implements HotelsAdapter {

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<List<HotelOffer>> search(String destination, LocalDate checkIn, LocalDate checkOut, int adults) {
        String key = CacheClient.buildKey(RedisConstants.CACHE_HOTELS_KEY, destination, checkIn, checkOut, Math.max(1, adults));
        List<HotelOffer> hotels = cacheClient.queryWithPassThrough(key, new TypeReference<List<HotelOffer>>() {
                }, () -> generate(DestinationResearch.cityOf(destination)),
                RedisConstants.CACHE_HOTELS_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(hotels);
    }

    private List<HotelOffer> generate(String city) {
        return List.of(
                hotel(city + " Grand Hotel", 4.5, 150.0, "City Center"),
                hotel(city + " Boutique Inn", 4.2, 120.0, "Old Town"),
                hotel(city + " Budget Stay", 3.5, 75.0, "Station District"),
                hotel(city + " Luxury Resort", 4.9, 300.0, "Waterfront"),
                hotel(city + " Central Plaza", 4.0, 100.0, "Main Square"),
                hotel(city + " Riverside Hotel", 4.3, 130.0, "Riverside"));
    }

    private HotelOffer hotel(String name, double rating, double price, String address) {
        return HotelOffer.builder()
                .name(name)
                .rating(rating)
                .pricePerNight(price)
                .address(address)
                .build();
    }
}
