package com.tripscout.server.adapter.impl;

import java.util.Locale;
import java.util.Map;

/**
 * 城市指南类数据的匹配：目的地文本包含表中的城市名即命中。
 */
final class CityGuides {

    private CityGuides() {
    }

    static <T> T match(Map<String, T> table, String destination, T fallback) {
        if (destination == null) {
            return fallback;
        }
        String lower = destination.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, T> e : table.entrySet()) {
            if (lower.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return fallback;
    }
}
