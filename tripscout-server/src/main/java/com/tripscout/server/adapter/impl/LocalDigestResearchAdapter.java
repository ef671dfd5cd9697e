package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.pojo.research.category.NightlifeGuide;
import com.tripscout.pojo.research.category.RestaurantGuide;
import com.tripscout.pojo.research.category.TransportGuide;
import com.tripscout.pojo.research.category.WebResearchSummary;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.NightlifeAdapter;
import com.tripscout.server.adapter.RestaurantsAdapter;
import com.tripscout.server.adapter.TransportAdapter;
import com.tripscout.server.adapter.WebResearchAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 「网络检索」类别的本地实现：把餐饮、交通、夜生活资料汇总成一段文字摘要。
 * 由 tripscout.research.web-research-enabled 控制是否启用。
 */
@Component
@RequiredArgsConstructor
public class LocalDigestResearchAdapter implements WebResearchAdapter {

    private final ResearchProperties researchProperties;
    private final RestaurantsAdapter restaurantsAdapter;
    private final TransportAdapter transportAdapter;
    private final NightlifeAdapter nightlifeAdapter;
    private final CacheClient cacheClient;

    @Override
    public boolean isEnabled() {
        return researchProperties.isWebResearchEnabled();
    }

    @Override
    public AdapterResult<WebResearchSummary> research(String destination, List<String> interests) {
        if (!isEnabled()) {
            return AdapterResult.fail("web", "not_configured", "web research is disabled");
        }
        String key = CacheClient.buildKey(RedisConstants.CACHE_WEB_KEY, destination,
                interests == null || interests.isEmpty() ? "any" : String.join(",", interests));
        WebResearchSummary summary = cacheClient.queryWithPassThrough(key, new TypeReference<WebResearchSummary>() {
                }, () -> digest(destination, interests),
                RedisConstants.CACHE_WEB_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(summary);
    }

    private WebResearchSummary digest(String destination, List<String> interests) {
        StringBuilder sb = new StringBuilder(destination);
        List<String> sources = new ArrayList<>();
        AdapterResult<RestaurantGuide> food = restaurantsAdapter.guide(destination, List.of());
        if (food.isOk()) {
            sb.append(". Food: ").append(String.join(", ", food.getValue().getSignatureDishes()));
            sources.add("local_food_guide");
        }
        AdapterResult<TransportGuide> transport = transportAdapter.guide(destination);
        if (transport.isOk()) {
            sb.append(". Getting around: ").append(transport.getValue().getTip());
            sources.add("local_transport_guide");
        }
        AdapterResult<NightlifeGuide> nightlife = nightlifeAdapter.guide(destination);
        if (nightlife.isOk()) {
            sb.append(". After dark: ").append(nightlife.getValue().getHighlight());
            sources.add("local_nightlife_guide");
        }
        if (interests != null && !interests.isEmpty()) {
            sb.append(". Interests considered: ").append(String.join(", ", interests));
        }
        return WebResearchSummary.builder()
                .summary(sb.append('.').toString())
                .sources(sources)
                .build();
    }
}
