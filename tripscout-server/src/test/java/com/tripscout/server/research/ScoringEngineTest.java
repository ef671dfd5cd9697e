package com.tripscout.server.research;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.CategoryResults;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.ScoreBreakdown;
import com.tripscout.pojo.research.category.AffordabilityInfo;
import com.tripscout.pojo.research.category.Attraction;
import com.tripscout.pojo.research.category.EventInfo;
import com.tripscout.pojo.research.category.VisaInfo;
import com.tripscout.pojo.research.category.WeatherInfo;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ScoringEngine 单元测试：
 * - 各子评分的加减分规则与缺失时的中性分；
 * - 子评分始终落在 [0, 100]；
 * - 总分等于固定权重加权和（保留一位小数）。
 */
class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    @Test
    void weatherScore_shouldRewardIdealTemperatureClearSkyAndMatchingPreference() {
        assertEquals(100, engine.weatherScore(weather(26, "Clear"), "warm"));
        assertEquals(55, engine.weatherScore(weather(18, "Rain"), "mild"));
        assertEquals(0, engine.weatherScore(weather(40, "Thunderstorm"), null));
        assertEquals(50, engine.weatherScore(null, "warm"));
    }

    @Test
    void weatherScore_shouldTreatMildUpperBoundAsExclusive() {
        // 25°C 属于 warm，不属于 mild
        assertEquals(90, engine.weatherScore(weather(25, "Clear"), "mild"));
        assertEquals(100, engine.weatherScore(weather(25, "Clear"), "warm"));
    }

    @Test
    void affordabilityScore_shouldCombineBudgetRatioAndStyleAlignment() {
        TravelPreferencesDTO moderate = prefs("moderate");
        assertEquals(100, engine.affordabilityScore(affordability(50.0, "budget"), moderate));

        TravelPreferencesDTO low = prefs("low");
        assertEquals(10, engine.affordabilityScore(affordability(150.0, "moderate"), low));

        TravelPreferencesDTO high = prefs("high");
        assertEquals(45, engine.affordabilityScore(affordability(400.0, "luxury"), high));

        assertEquals(50, engine.affordabilityScore(null, moderate));
    }

    @Test
    void affordabilityScore_shouldPreferBudgetAmountOverBudgetLevel() {
        TravelPreferencesDTO p = prefs("luxury");
        p.setBudgetAmount(700.0);
        p.setTravelStart(LocalDate.of(2026, 6, 1));
        p.setTravelEnd(LocalDate.of(2026, 6, 8));

        assertEquals(100.0, engine.userDailyBudget(p), 0.0001);
        // ratio 1.0 -> 80，luxury x moderate -> -10
        assertEquals(70, engine.affordabilityScore(affordability(100.0, "moderate"), p));
    }

    @Test
    void visaScore_shouldFollowRequirementEvisaProcessingAndCost() {
        VisaInfo free = VisaInfo.builder().visaRequired(false).build();
        assertEquals(100, engine.visaScore(free, null));

        VisaInfo evisa = VisaInfo.builder().visaRequired(true).evisaAvailable(true)
                .processingDays(3).costUsd(35.0).build();
        assertEquals(96.5, engine.visaScore(evisa, "evisa_ok"), 0.0001);

        VisaInfo embassy = VisaInfo.builder().visaRequired(true).evisaAvailable(false).build();
        assertEquals(30, engine.visaScore(embassy, null));
        assertEquals(20, engine.visaScore(embassy, "evisa_ok"));

        assertEquals(50, engine.visaScore(null, null));
    }

    @Test
    void attractionsScore_shouldCombineQuantityRatingAndInterestShare() {
        List<Attraction> five = attractions(2, 3, 4.0);

        assertEquals(20, engine.attractionsScore(List.of(), List.of("nature")));
        assertEquals(84, engine.attractionsScore(five, List.of()), 0.0001);
        assertEquals(54, engine.attractionsScore(five, List.of("nature")), 0.0001);
        assertEquals(69, engine.attractionsScore(five, List.of("culture", "nature")), 0.0001);
        assertEquals(44, engine.attractionsScore(five, List.of("food")), 0.0001);
    }

    @Test
    void eventsScore_shouldScaleWithCountAndDefaultWhenAbsent() {
        assertEquals(30, engine.eventsScore(null));
        assertEquals(30, engine.eventsScore(List.of()));
        assertEquals(40, engine.eventsScore(events(4)));
        assertEquals(100, engine.eventsScore(events(12)));
    }

    @Test
    void interestAlignment_shouldNormalizePerInterestPoints() {
        CategoryResults c = new CategoryResults();
        List<Attraction> list = new ArrayList<>(attractions(3, 0, 4.5));
        list.add(Attraction.builder().name("Art Museum").type("museum").rating(4.2).natural(false).build());
        c.setAttractions(list);

        assertEquals(50, engine.interestAlignment(c, List.of()));
        // nature 3 个匹配 -> 20，art 1 个匹配 -> 10
        assertEquals(75, engine.interestAlignment(c, List.of("nature", "art")), 0.0001);
        assertEquals(25, engine.interestAlignment(c, List.of("shopping", "karaoke")), 0.0001);
    }

    @Test
    void subScores_shouldStayWithinBounds() {
        double[] temps = {-40, -5, 0, 10, 17, 24, 30, 34, 50};
        String[] conditions = {"Clear", "Clouds", "Rain", "Snow", "Thunderstorm", "Drizzle", "Mist", "Haze"};
        for (double t : temps) {
            for (String cond : conditions) {
                double s = engine.weatherScore(weather(t, cond), "hot");
                assertTrue(s >= 0 && s <= 100, "weather out of range: " + s);
            }
        }
        for (String level : List.of("low", "moderate", "high", "luxury")) {
            for (double cost : new double[]{1, 50, 150, 400, 5000}) {
                for (String costLevel : List.of("budget", "moderate", "comfort", "luxury")) {
                    double s = engine.affordabilityScore(affordability(cost, costLevel), prefs(level));
                    assertTrue(s >= 0 && s <= 100, "affordability out of range: " + s);
                }
            }
        }
        VisaInfo expensive = VisaInfo.builder().visaRequired(true).evisaAvailable(false).costUsd(900.0).build();
        assertTrue(engine.visaScore(expensive, "evisa_ok") >= 0);
        assertTrue(engine.attractionsScore(attractions(20, 20, 5.0), List.of("nature", "culture")) <= 100);
        assertTrue(engine.eventsScore(events(50)) <= 100);
    }

    @Test
    void score_shouldReturnFixedWeightSumRoundedToOneDecimal() {
        DestinationResearch dr = new DestinationResearch("Bali, Indonesia");
        dr.getCategories().setWeather(weather(26, "Clear"));
        dr.getCategories().setVisa(VisaInfo.builder().visaRequired(false).build());
        dr.getCategories().setAttractions(attractions(2, 3, 4.0));
        dr.getCategories().setAffordability(affordability(50.0, "budget"));

        TravelPreferencesDTO p = prefs("moderate");
        p.setWeatherPreference("warm");

        ScoreBreakdown s = engine.score(dr, p);

        assertEquals(100, s.getWeather());
        assertEquals(100, s.getAffordability());
        assertEquals(100, s.getVisa());
        assertEquals(84, s.getAttractions(), 0.0001);
        assertEquals(30, s.getEvents());
        assertEquals(50, s.getInterestAlignment());
        double expected = 100 * 0.20 + 100 * 0.25 + 100 * 0.15 + 84 * 0.20 + 30 * 0.10 + 50 * 0.10;
        assertEquals(Math.round(expected * 10) / 10.0, s.getOverall(), 0.0001);
    }

    @Test
    void travelStyle_shouldMapBudgetLevels() {
        assertEquals("budget", ScoringEngine.travelStyle("low"));
        assertEquals("moderate", ScoringEngine.travelStyle("moderate"));
        assertEquals("comfort", ScoringEngine.travelStyle("high"));
        assertEquals("luxury", ScoringEngine.travelStyle("luxury"));
        assertEquals("moderate", ScoringEngine.travelStyle(null));
    }

    private static WeatherInfo weather(double temp, String condition) {
        return WeatherInfo.builder().temperature(temp).condition(condition).build();
    }

    private static AffordabilityInfo affordability(double dailyCost, String costLevel) {
        return AffordabilityInfo.builder().dailyCost(dailyCost).costLevel(costLevel).build();
    }

    private static TravelPreferencesDTO prefs(String budgetLevel) {
        TravelPreferencesDTO p = new TravelPreferencesDTO();
        p.setBudgetLevel(budgetLevel);
        return p;
    }

    private static List<Attraction> attractions(int natural, int cultural, double rating) {
        List<Attraction> list = new ArrayList<>();
        for (int i = 0; i < natural; i++) {
            list.add(Attraction.builder().name("Park " + i).type("national_park").rating(rating).natural(true).build());
        }
        for (int i = 0; i < cultural; i++) {
            list.add(Attraction.builder().name("Landmark " + i).type("landmark").rating(rating).natural(false).build());
        }
        return list;
    }

    private static List<EventInfo> events(int n) {
        List<EventInfo> list = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            list.add(EventInfo.builder().name("Event " + i).category("music").build());
        }
        return list;
    }
}
