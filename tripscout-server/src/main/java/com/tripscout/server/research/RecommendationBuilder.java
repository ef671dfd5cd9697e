package com.tripscout.server.research;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.CategoryResults;
import com.tripscout.pojo.research.ComparisonRow;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.Recommendation;
import com.tripscout.pojo.research.RecommendationHighlights;
import com.tripscout.pojo.research.ResearchContext;
import com.tripscout.pojo.research.category.Attraction;
import com.tripscout.pojo.research.category.EventInfo;
import com.tripscout.pojo.research.category.FlightOffer;
import com.tripscout.pojo.research.category.HotelOffer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 根据已打分的目的地生成对比表与前 3 名推荐（理由 + 亮点 + 预估花费）。
 * 只有 completed / partial 的目的地参与排序。
 */
@Component
@RequiredArgsConstructor
public class RecommendationBuilder {

    static final int MAX_RECOMMENDATIONS = 3;
    private static final int TRANSPORT_TIP_LENGTH = 50;

    private final ScoringEngine scoringEngine;

    public List<ComparisonRow> comparison(List<DestinationResearch> destinations, TravelPreferencesDTO preferences) {
        return ranked(destinations).stream()
                .map(d -> toRow(d, preferences))
                .toList();
    }

    public List<Recommendation> recommendations(List<DestinationResearch> destinations, TravelPreferencesDTO preferences) {
        List<DestinationResearch> ranked = ranked(destinations);
        List<Recommendation> result = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_RECOMMENDATIONS, ranked.size()); i++) {
            DestinationResearch d = ranked.get(i);
            CategoryResults c = d.getCategories();
            result.add(Recommendation.builder()
                    .rank(i + 1)
                    .destination(d.getName())
                    .score(d.getOverallScore())
                    .reasons(reasons(d, preferences))
                    .highlights(highlights(c))
                    .estimatedCost(c.getAffordability() == null ? null : c.getAffordability().getEstimatedTripCost())
                    .build());
        }
        return result;
    }

    /**
     * within_budget / slightly_over / over_budget，缺少消费数据时为 unknown。
     */
    public String budgetFit(DestinationResearch destination, TravelPreferencesDTO preferences) {
        CategoryResults c = destination.getCategories();
        if (c == null || c.getAffordability() == null || c.getAffordability().getDailyCost() == null
                || c.getAffordability().getDailyCost() <= 0) {
            return "unknown";
        }
        double ratio = scoringEngine.userDailyBudget(preferences) / c.getAffordability().getDailyCost();
        if (ratio >= 1.0) {
            return "within_budget";
        }
        return ratio >= 0.85 ? "slightly_over" : "over_budget";
    }

    List<String> reasons(DestinationResearch d, TravelPreferencesDTO preferences) {
        CategoryResults c = d.getCategories();
        ResearchContext ctx = d.getContext() == null ? new ResearchContext() : d.getContext();
        List<String> reasons = new ArrayList<>();

        if (d.getOverallScore() != null && d.getOverallScore() > 80) {
            reasons.add("Excellent overall match for your preferences");
        }
        if (c.getVisa() != null && Boolean.FALSE.equals(c.getVisa().getVisaRequired())) {
            reasons.add("No visa required");
        }
        if (c.getWeather() != null && c.getWeather().getTemperature() != null) {
            double temp = c.getWeather().getTemperature();
            if (temp >= 20 && temp <= 30) {
                reasons.add("Great weather (" + Math.round(temp) + "°C)");
            }
        }
        if ("within_budget".equals(budgetFit(d, preferences))) {
            reasons.add("Fits your budget");
        }
        if (c.getEvents() != null && !c.getEvents().isEmpty()) {
            reasons.add(c.getEvents().size() + " events during your stay");
        }

        String with = ctx.getTravelingWith() == null ? "solo" : ctx.getTravelingWith();
        if ("family".equalsIgnoreCase(with) && ctx.isHasKids() && c.getAttractions() != null) {
            long kidFriendly = c.getAttractions().stream()
                    .filter(a -> Boolean.TRUE.equals(a.getKidFriendly()))
                    .count();
            if (kidFriendly > 0) {
                reasons.add(kidFriendly + " kid-friendly attractions found");
            }
        }
        if ("couple".equalsIgnoreCase(with)) {
            reasons.add("Great romantic getaway destination");
        }
        if ("group".equalsIgnoreCase(with) && c.getNightlife() != null) {
            reasons.add("Excellent nightlife scene for groups");
        }
        if (ctx.getDietaryRestrictions() != null && !ctx.getDietaryRestrictions().isEmpty()) {
            reasons.add("Accommodates " + String.join(", ", ctx.getDietaryRestrictions()) + " dietary needs");
        }
        if (ctx.getAccessibilityNeeds() != null && ctx.getAccessibilityNeeds().stream()
                .anyMatch(n -> n != null && !n.isBlank() && !"none".equalsIgnoreCase(n.trim()))) {
            reasons.add("Accessibility information included");
        }
        if ("relaxed".equalsIgnoreCase(ctx.getPacePreference())) {
            reasons.add("Ideal for a relaxed, unhurried pace");
        } else if ("busy".equalsIgnoreCase(ctx.getPacePreference())) {
            reasons.add("Packed with activities to keep you busy");
        }
        return reasons;
    }

    RecommendationHighlights highlights(CategoryResults c) {
        RecommendationHighlights h = new RecommendationHighlights();
        if (c.getAttractions() != null) {
            h.setTopAttractions(c.getAttractions().stream().limit(3).map(Attraction::getName).toList());
        }
        if (c.getEvents() != null) {
            h.setTopEvents(c.getEvents().stream().limit(2).map(EventInfo::getName).toList());
        }
        if (c.getHotels() != null) {
            c.getHotels().stream()
                    .map(HotelOffer::getPricePerNight)
                    .filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .ifPresent(h::setHotelFrom);
        }
        if (c.getFlights() != null) {
            c.getFlights().stream()
                    .map(FlightOffer::getPrice)
                    .filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .ifPresent(h::setFlightFrom);
        }
        if (c.getRestaurants() != null) {
            List<String> picks = c.getRestaurants().getRecommendedRestaurants();
            if (picks != null && !picks.isEmpty()) {
                h.setDiningHighlight(picks.get(0));
            }
            List<String> dishes = c.getRestaurants().getSignatureDishes();
            if (dishes != null && !dishes.isEmpty()) {
                h.setSignatureDish(dishes.get(0));
            }
        }
        if (c.getTransport() != null && c.getTransport().getTip() != null) {
            String tip = c.getTransport().getTip();
            h.setTransportTip(tip.length() > TRANSPORT_TIP_LENGTH ? tip.substring(0, TRANSPORT_TIP_LENGTH) + "..." : tip);
        }
        if (c.getNightlife() != null) {
            h.setNightlifeHighlight(c.getNightlife().getHighlight());
        }
        return h;
    }

    private ComparisonRow toRow(DestinationResearch d, TravelPreferencesDTO preferences) {
        CategoryResults c = d.getCategories();
        return ComparisonRow.builder()
                .name(d.getName())
                .overallScore(d.getOverallScore())
                .status(d.getStatus())
                .temperature(c.getWeather() == null ? null : c.getWeather().getTemperature())
                .weatherCondition(c.getWeather() == null ? null : c.getWeather().getCondition())
                .visaRequired(c.getVisa() == null ? null : c.getVisa().getVisaRequired())
                .attractionsCount(c.getAttractions() == null ? 0 : c.getAttractions().size())
                .budgetFit(budgetFit(d, preferences))
                .costLevel(c.getAffordability() == null ? null : c.getAffordability().getCostLevel())
                .eventsCount(c.getEvents() == null ? 0 : c.getEvents().size())
                .scores(d.getScores())
                .build();
    }

    /**
     * 按总分降序；同分时保持原有顺序。
     */
    private List<DestinationResearch> ranked(List<DestinationResearch> destinations) {
        return destinations.stream()
                .filter(d -> d.getStatus() != null && d.getStatus().isRanked())
                .sorted(Comparator.comparing((DestinationResearch d) ->
                        d.getOverallScore() == null ? 0.0 : d.getOverallScore()).reversed())
                .toList();
    }
}
