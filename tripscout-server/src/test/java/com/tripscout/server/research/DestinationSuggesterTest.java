package com.tripscout.server.research;

import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * DestinationSuggester 单元测试：按兴趣、预算推荐，去重、截断与默认列表。
 */
class DestinationSuggesterTest {

    private final DestinationSuggester suggester = new DestinationSuggester(new ResearchProperties());

    @Test
    void suggest_shouldKeepInterestOrderAndCapAtEight() {
        TravelPreferencesDTO p = new TravelPreferencesDTO();
        p.setInterests(List.of("beach", "nightlife"));
        p.setBudgetLevel("low");

        List<String> result = suggester.suggest(p);

        assertEquals(List.of("Bali, Indonesia", "Maldives", "Phuket, Thailand", "Santorini, Greece", "Maui, Hawaii",
                "Berlin, Germany", "Amsterdam, Netherlands", "Las Vegas, USA"), result);
    }

    @Test
    void suggest_shouldRemoveDuplicatesAcrossInterests() {
        TravelPreferencesDTO p = new TravelPreferencesDTO();
        p.setInterests(List.of("Food", "city"));

        List<String> result = suggester.suggest(p);

        assertEquals(List.of("Tokyo, Japan", "Bangkok, Thailand", "Barcelona, Spain", "Mexico City, Mexico",
                "Lyon, France", "Paris, France", "New York, USA", "Singapore"), result);
    }

    @Test
    void suggest_shouldFallBackToBudgetTable_whenNoInterests() {
        TravelPreferencesDTO p = new TravelPreferencesDTO();
        p.setBudgetLevel("luxury");

        List<String> result = suggester.suggest(p);

        assertEquals(List.of("Switzerland", "Maldives", "Monaco", "Bora Bora", "Seychelles", "Dubai, UAE"), result);
    }

    @Test
    void suggest_shouldReturnDefaults_whenNothingMatches() {
        TravelPreferencesDTO p = new TravelPreferencesDTO();
        p.setInterests(List.of("karaoke"));
        p.setBudgetLevel(null);

        assertEquals(DestinationSuggester.DEFAULT_DESTINATIONS, suggester.suggest(p));
    }
}
