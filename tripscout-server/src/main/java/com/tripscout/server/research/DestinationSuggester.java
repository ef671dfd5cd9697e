package com.tripscout.server.research;

import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 未指定目的地时，按兴趣与预算档位推荐候选目的地。
 */
@Component
@RequiredArgsConstructor
public class DestinationSuggester {

    static final List<String> DEFAULT_DESTINATIONS = List.of("Paris, France", "Tokyo, Japan", "Barcelona, Spain");

    private static final Map<String, List<String>> BY_INTEREST = Map.of(
            "beach", List.of("Bali, Indonesia", "Maldives", "Phuket, Thailand", "Santorini, Greece", "Maui, Hawaii"),
            "mountain", List.of("Swiss Alps, Switzerland", "Banff, Canada", "Queenstown, New Zealand",
                    "Chamonix, France", "Kathmandu, Nepal"),
            "city", List.of("Tokyo, Japan", "Paris, France", "New York, USA", "Barcelona, Spain", "Singapore"),
            "history", List.of("Rome, Italy", "Athens, Greece", "Cairo, Egypt", "Kyoto, Japan", "Machu Picchu, Peru"),
            "nature", List.of("Costa Rica", "Iceland", "Patagonia, Chile", "Kenya", "Norway"),
            "adventure", List.of("Queenstown, New Zealand", "Interlaken, Switzerland", "Moab, USA",
                    "Cape Town, South Africa", "Reykjavik, Iceland"),
            "food", List.of("Tokyo, Japan", "Bangkok, Thailand", "Barcelona, Spain", "Mexico City, Mexico", "Lyon, France"),
            "culture", List.of("Marrakech, Morocco", "Istanbul, Turkey", "Varanasi, India", "Havana, Cuba",
                    "Prague, Czech Republic"),
            "relaxation", List.of("Bali, Indonesia", "Tulum, Mexico", "Seychelles", "Fiji", "Santorini, Greece"),
            "nightlife", List.of("Berlin, Germany", "Amsterdam, Netherlands", "Las Vegas, USA",
                    "Rio de Janeiro, Brazil", "Bangkok, Thailand"));

    private static final Map<String, List<String>> BY_BUDGET = Map.of(
            "low", List.of("Vietnam", "Thailand", "Mexico", "Portugal", "Colombia", "Indonesia", "India"),
            "moderate", List.of("Spain", "Greece", "Turkey", "Malaysia", "Czech Republic", "Poland", "Argentina"),
            "high", List.of("Japan", "France", "Italy", "Australia", "UAE", "Singapore", "South Korea"),
            "luxury", List.of("Switzerland", "Maldives", "Monaco", "Bora Bora", "Seychelles", "Dubai, UAE"));

    private final ResearchProperties researchProperties;

    /**
     * 先按兴趣顺序取，再追加预算档位对应的国家，去重后截断到上限；结果为空时返回默认列表。
     */
    public List<String> suggest(TravelPreferencesDTO preferences) {
        Set<String> result = new LinkedHashSet<>();
        if (preferences.getInterests() != null) {
            for (String interest : preferences.getInterests()) {
                if (interest == null) {
                    continue;
                }
                result.addAll(BY_INTEREST.getOrDefault(interest.trim().toLowerCase(Locale.ROOT), List.of()));
            }
        }
        if (preferences.getBudgetLevel() != null) {
            result.addAll(BY_BUDGET.getOrDefault(preferences.getBudgetLevel().trim().toLowerCase(Locale.ROOT), List.of()));
        }
        if (result.isEmpty()) {
            return new ArrayList<>(DEFAULT_DESTINATIONS);
        }
        return result.stream().limit(researchProperties.getMaxSuggestions()).toList();
    }
}
