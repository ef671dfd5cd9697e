package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.AffordabilityInfo;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.AffordabilityAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于消费指数表的消费水平数据源。未收录国家按美国数据估算。
 */
@Component
@RequiredArgsConstructor
public class StaticAffordabilityAdapter implements AffordabilityAdapter {

    private static final String DEFAULT_COUNTRY = "US";

    /** country -> {index, budget, moderate, comfort, luxury} */
    private static final Map<String, int[]> COST_INDEX = new HashMap<>();

    static {
        COST_INDEX.put("US", new int[]{100, 80, 150, 250, 500});
        COST_INDEX.put("FR", new int[]{85, 70, 140, 220, 450});
        COST_INDEX.put("JP", new int[]{90, 75, 150, 250, 500});
        COST_INDEX.put("ID", new int[]{35, 25, 50, 100, 250});
        COST_INDEX.put("GB", new int[]{90, 80, 160, 280, 550});
        COST_INDEX.put("AE", new int[]{80, 60, 120, 220, 500});
        COST_INDEX.put("SG", new int[]{95, 70, 140, 250, 550});
        COST_INDEX.put("AU", new int[]{85, 75, 150, 250, 500});
        COST_INDEX.put("IT", new int[]{75, 60, 120, 200, 400});
        COST_INDEX.put("ES", new int[]{70, 55, 110, 180, 380});
        COST_INDEX.put("ZA", new int[]{45, 35, 70, 120, 280});
        COST_INDEX.put("MA", new int[]{35, 25, 50, 100, 250});
        COST_INDEX.put("TH", new int[]{40, 30, 60, 120, 280});
        COST_INDEX.put("TR", new int[]{35, 25, 55, 110, 250});
        COST_INDEX.put("IS", new int[]{110, 100, 200, 350, 700});
        COST_INDEX.put("BR", new int[]{40, 35, 70, 130, 300});
        COST_INDEX.put("EG", new int[]{25, 20, 40, 80, 200});
        COST_INDEX.put("CZ", new int[]{55, 40, 80, 150, 320});
        COST_INDEX.put("NZ", new int[]{85, 75, 150, 260, 520});
        COST_INDEX.put("IN", new int[]{25, 20, 45, 90, 220});
        COST_INDEX.put("VN", new int[]{30, 20, 45, 90, 200});
        COST_INDEX.put("PH", new int[]{35, 25, 50, 100, 250});
        COST_INDEX.put("MX", new int[]{45, 35, 70, 130, 300});
        COST_INDEX.put("GR", new int[]{65, 50, 100, 170, 350});
        COST_INDEX.put("PT", new int[]{65, 50, 100, 170, 350});
        COST_INDEX.put("NL", new int[]{88, 75, 150, 260, 520});
        COST_INDEX.put("DE", new int[]{82, 70, 140, 230, 480});
        COST_INDEX.put("CH", new int[]{130, 120, 240, 400, 800});
        COST_INDEX.put("SE", new int[]{95, 85, 170, 280, 550});
        COST_INDEX.put("NO", new int[]{110, 100, 200, 350, 700});
        COST_INDEX.put("DK", new int[]{100, 90, 180, 300, 600});
        COST_INDEX.put("FI", new int[]{90, 80, 160, 270, 540});
        COST_INDEX.put("KR", new int[]{80, 60, 120, 200, 450});
        COST_INDEX.put("CN", new int[]{45, 35, 70, 130, 300});
        COST_INDEX.put("MY", new int[]{45, 35, 70, 130, 300});
        COST_INDEX.put("KH", new int[]{30, 20, 45, 90, 200});
        COST_INDEX.put("PE", new int[]{35, 25, 55, 110, 260});
        COST_INDEX.put("CL", new int[]{55, 45, 90, 160, 350});
        COST_INDEX.put("AR", new int[]{40, 30, 65, 120, 280});
        COST_INDEX.put("CO", new int[]{35, 25, 55, 110, 260});
    }

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<AffordabilityInfo> estimate(String destinationCountry, String travelStyle, int days) {
        String country = destinationCountry == null || !COST_INDEX.containsKey(destinationCountry.toUpperCase(Locale.ROOT))
                ? DEFAULT_COUNTRY : destinationCountry.toUpperCase(Locale.ROOT);
        String style = travelStyle == null ? "moderate" : travelStyle.toLowerCase(Locale.ROOT);
        int tripDays = Math.max(1, days);
        String key = CacheClient.buildKey(RedisConstants.CACHE_AFFORDABILITY_KEY, country, style, tripDays);
        AffordabilityInfo info = cacheClient.queryWithPassThrough(key, new TypeReference<AffordabilityInfo>() {
                }, () -> compute(country, style, tripDays),
                RedisConstants.CACHE_AFFORDABILITY_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(info);
    }

    static AffordabilityInfo compute(String country, String style, int days) {
        int[] row = COST_INDEX.get(country);
        int index = row[0];
        Map<String, Double> dailyBudget = new LinkedHashMap<>();
        dailyBudget.put("budget", (double) row[1]);
        dailyBudget.put("moderate", (double) row[2]);
        dailyBudget.put("comfort", (double) row[3]);
        dailyBudget.put("luxury", (double) row[4]);
        double daily = dailyBudget.getOrDefault(style, 150.0);

        // 住宿 / 餐饮 / 交通 / 活动
        double[] pct = switch (style) {
            case "budget" -> new double[]{0.30, 0.30, 0.20, 0.20};
            case "luxury" -> new double[]{0.50, 0.20, 0.10, 0.20};
            default -> new double[]{0.40, 0.25, 0.15, 0.20};
        };
        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("accommodation", daily * pct[0]);
        breakdown.put("food", daily * pct[1]);
        breakdown.put("transport", daily * pct[2]);
        breakdown.put("activities", daily * pct[3]);

        return AffordabilityInfo.builder()
                .countryCode(country)
                .costIndex(index)
                .costLevel(costLevelOf(index))
                .dailyCost(daily)
                .dailyBudget(dailyBudget)
                .breakdown(breakdown)
                .estimatedTripCost(daily * days)
                .build();
    }

    static String costLevelOf(int index) {
        if (index < 40) {
            return "budget";
        } else if (index < 60) {
            return "moderate";
        } else if (index < 85) {
            return "comfort";
        }
        return "luxury";
    }
}
