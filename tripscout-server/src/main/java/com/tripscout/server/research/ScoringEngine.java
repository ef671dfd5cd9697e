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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * 目的地评分引擎：纯计算，无 IO。
 *
 * 六项子评分均限制在 [0, 100]，缺失类别使用中性分：
 * 天气 50、消费 50、签证 50、景点 20、活动 30、兴趣匹配（无兴趣）50。
 */
@Component
public class ScoringEngine {

    static final double NEUTRAL_WEATHER = 50;
    static final double NEUTRAL_AFFORDABILITY = 50;
    static final double NEUTRAL_VISA = 50;
    static final double NO_ATTRACTIONS = 20;
    static final double NO_EVENTS = 30;
    static final double NO_INTERESTS = 50;

    private static final Set<String> NATURAL_INTERESTS =
            Set.of("nature", "beach", "beaches", "mountain", "mountains", "adventure", "wildlife", "hiking");
    private static final Set<String> CULTURAL_INTERESTS =
            Set.of("culture", "history", "art", "architecture");

    private static final Map<String, Double> CONDITION_ADJUSTMENT = Map.of(
            "clear", 15.0,
            "clouds", 5.0,
            "rain", -15.0,
            "snow", -5.0,
            "thunderstorm", -25.0,
            "drizzle", -10.0,
            "mist", -5.0);

    /** 出行风格 x 目的地消费等级 */
    private static final Map<String, Map<String, Double>> STYLE_ALIGNMENT = Map.of(
            "budget", Map.of("budget", 20.0, "moderate", 5.0, "comfort", -10.0, "luxury", -20.0),
            "moderate", Map.of("budget", 5.0, "moderate", 20.0, "comfort", 10.0, "luxury", -10.0),
            "comfort", Map.of("budget", -10.0, "moderate", 10.0, "comfort", 20.0, "luxury", 5.0),
            "luxury", Map.of("budget", -20.0, "moderate", -10.0, "comfort", 10.0, "luxury", 20.0));

    /** 未填写预算金额时按预算档位估算的日均预算（美元） */
    private static final Map<String, Double> DAILY_BUDGET_BY_LEVEL = Map.of(
            "low", 60.0,
            "moderate", 150.0,
            "high", 300.0,
            "luxury", 600.0);

    public ScoreBreakdown score(DestinationResearch destination, TravelPreferencesDTO preferences) {
        CategoryResults c = destination.getCategories() == null ? new CategoryResults() : destination.getCategories();
        List<String> interests = normalizedInterests(preferences);
        return ScoreBreakdown.of(
                weatherScore(c.getWeather(), preferences.getWeatherPreference()),
                affordabilityScore(c.getAffordability(), preferences),
                visaScore(c.getVisa(), preferences.getVisaPreference()),
                attractionsScore(c.getAttractions(), interests),
                eventsScore(c.getEvents()),
                interestAlignment(c, interests));
    }

    public double weatherScore(WeatherInfo weather, String preference) {
        if (weather == null || weather.getTemperature() == null) {
            return NEUTRAL_WEATHER;
        }
        double temp = weather.getTemperature();
        double score = 50;
        if (temp >= 20 && temp <= 28) {
            score += 25;
        } else if ((temp >= 15 && temp < 20) || (temp > 28 && temp <= 32)) {
            score += 10;
        } else if ((temp >= 5 && temp < 15) || (temp > 32 && temp <= 35)) {
            score -= 10;
        } else {
            score -= 25;
        }
        String condition = weather.getCondition() == null ? "" : weather.getCondition().toLowerCase(Locale.ROOT);
        score += CONDITION_ADJUSTMENT.getOrDefault(condition, 0.0);
        if (preference != null && matchesWeatherPreference(preference.toLowerCase(Locale.ROOT), temp, condition)) {
            score += 10;
        }
        return clamp(score);
    }

    private boolean matchesWeatherPreference(String preference, double temp, String condition) {
        return switch (preference) {
            case "hot" -> temp > 30;
            case "warm" -> temp >= 25 && temp <= 30;
            case "mild" -> temp >= 15 && temp < 25;
            case "cold" -> temp >= 5 && temp < 15;
            case "snow", "snowy" -> "snow".equals(condition);
            default -> false;
        };
    }

    public double affordabilityScore(AffordabilityInfo affordability, TravelPreferencesDTO preferences) {
        if (affordability == null || affordability.getDailyCost() == null || affordability.getDailyCost() <= 0) {
            return NEUTRAL_AFFORDABILITY;
        }
        double ratio = userDailyBudget(preferences) / affordability.getDailyCost();
        double score;
        if (ratio >= 1.5) {
            score = 100;
        } else if (ratio >= 1.25) {
            score = 90;
        } else if (ratio >= 1.0) {
            score = 80;
        } else if (ratio >= 0.85) {
            score = 60;
        } else if (ratio >= 0.7) {
            score = 40;
        } else if (ratio >= 0.6) {
            score = 20;
        } else {
            score = 5;
        }
        Map<String, Double> row = STYLE_ALIGNMENT.get(travelStyle(preferences.getBudgetLevel()));
        if (row != null && affordability.getCostLevel() != null) {
            score += row.getOrDefault(affordability.getCostLevel(), 0.0);
        }
        return clamp(score);
    }

    public double visaScore(VisaInfo visa, String visaPreference) {
        if (visa == null || visa.getVisaRequired() == null) {
            return NEUTRAL_VISA;
        }
        if (!visa.getVisaRequired()) {
            return 100;
        }
        double score = 30;
        boolean evisa = Boolean.TRUE.equals(visa.getEvisaAvailable());
        if (evisa) {
            score += 30;
        }
        Integer days = visa.getProcessingDays();
        if (days != null) {
            if (days <= 1) {
                score += 20;
            } else if (days <= 3) {
                score += 10;
            } else if (days <= 7) {
                score += 5;
            }
        }
        if (visa.getCostUsd() != null) {
            score += Math.max(0, (200 - visa.getCostUsd()) / 200 * 20);
        }
        if ("evisa_ok".equalsIgnoreCase(visaPreference)) {
            score += evisa ? 10 : -10;
        }
        return clamp(score);
    }

    public double attractionsScore(List<Attraction> attractions, List<String> interests) {
        if (attractions == null || attractions.isEmpty()) {
            return NO_ATTRACTIONS;
        }
        int n = attractions.size();
        double quantity = Math.min(n * 4, 20);
        double avgRating = attractions.stream()
                .mapToDouble(a -> a.getRating() == null ? 0 : a.getRating())
                .average()
                .orElse(0);
        double quality = avgRating / 5.0 * 30;

        double interestScore;
        if (interests.isEmpty()) {
            interestScore = 40;
        } else {
            long natural = attractions.stream().filter(Attraction::isNatural).count();
            double naturalShare = (double) natural / n;
            interestScore = 0;
            if (interests.stream().anyMatch(NATURAL_INTERESTS::contains)) {
                interestScore += naturalShare * 25;
            }
            if (interests.stream().anyMatch(CULTURAL_INTERESTS::contains)) {
                interestScore += (1 - naturalShare) * 25;
            }
            interestScore = Math.min(interestScore, 50);
        }
        return clamp(quantity + quality + interestScore);
    }

    public double eventsScore(List<EventInfo> events) {
        if (events == null || events.isEmpty()) {
            return NO_EVENTS;
        }
        return clamp(Math.min(events.size() * 10, 100));
    }

    /**
     * 每个兴趣最多 20 分（匹配 >=3 得 20，>=1 得 10），再按 20 x 兴趣数归一化到 0-100。
     */
    public double interestAlignment(CategoryResults categories, List<String> interests) {
        if (interests.isEmpty()) {
            return NO_INTERESTS;
        }
        double total = 0;
        for (String interest : interests) {
            int matches = countMatches(interest, categories);
            if (matches >= 3) {
                total += 20;
            } else if (matches >= 1) {
                total += 10;
            }
        }
        return clamp(total / (20.0 * interests.size()) * 100);
    }

    private int countMatches(String interest, CategoryResults c) {
        List<Attraction> attractions = c.getAttractions() == null ? List.of() : c.getAttractions();
        ToIntFunction<Predicate<Attraction>> count =
                p -> (int) attractions.stream().filter(p).count();
        return switch (interest) {
            case "nature" -> count.applyAsInt(Attraction::isNatural);
            case "beach", "beaches" -> count.applyAsInt(a -> typeContains(a, "beach"));
            case "mountain", "mountains", "hiking" ->
                    count.applyAsInt(a -> typeContains(a, "mountain") || typeContains(a, "hiking")
                            || typeContains(a, "national_park"));
            case "culture" -> count.applyAsInt(a -> !a.isNatural());
            case "history" -> count.applyAsInt(a -> typeContains(a, "landmark") || typeContains(a, "museum"));
            case "art" -> count.applyAsInt(a -> typeContains(a, "museum"));
            case "adventure" -> count.applyAsInt(a -> typeContains(a, "hiking_area")
                    || typeContains(a, "waterfall") || typeContains(a, "national_park"));
            case "relaxation" -> c.getAffordability() != null
                    && ("budget".equals(c.getAffordability().getCostLevel())
                    || "moderate".equals(c.getAffordability().getCostLevel())) ? 1 : 0;
            case "food", "shopping" -> 1;
            case "nightlife" -> c.getEvents() == null ? 0 : (int) c.getEvents().stream()
                    .filter(e -> "music".equalsIgnoreCase(e.getCategory()))
                    .count();
            case "wildlife" -> count.applyAsInt(a ->
                    (a.getDescription() != null && a.getDescription().toLowerCase(Locale.ROOT).contains("wildlife"))
                            || typeContains(a, "park") || typeContains(a, "nature"));
            default -> 0;
        };
    }

    private boolean typeContains(Attraction a, String token) {
        return a.getType() != null && a.getType().toLowerCase(Locale.ROOT).contains(token);
    }

    /**
     * 用户日均预算：有总预算时按行程天数平摊，否则按预算档位估算。
     */
    public double userDailyBudget(TravelPreferencesDTO preferences) {
        if (preferences.getBudgetAmount() != null && preferences.getBudgetAmount() > 0) {
            return preferences.getBudgetAmount() / preferences.tripDays();
        }
        String level = preferences.getBudgetLevel() == null ? "moderate" : preferences.getBudgetLevel().toLowerCase(Locale.ROOT);
        return DAILY_BUDGET_BY_LEVEL.getOrDefault(level, 150.0);
    }

    /**
     * 预算档位映射到出行风格：low->budget, moderate->moderate, high->comfort, luxury->luxury。
     */
    public static String travelStyle(String budgetLevel) {
        if (budgetLevel == null) {
            return "moderate";
        }
        return switch (budgetLevel.toLowerCase(Locale.ROOT)) {
            case "low", "budget" -> "budget";
            case "high", "comfort" -> "comfort";
            case "luxury" -> "luxury";
            default -> "moderate";
        };
    }

    static List<String> normalizedInterests(TravelPreferencesDTO preferences) {
        if (preferences.getInterests() == null) {
            return List.of();
        }
        return preferences.getInterests().stream()
                .filter(i -> i != null && !i.isBlank())
                .map(i -> i.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
