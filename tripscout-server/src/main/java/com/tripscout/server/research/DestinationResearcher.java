package com.tripscout.server.research;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.CategoryResults;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.DestinationStatus;
import com.tripscout.pojo.research.ResearchCategory;
import com.tripscout.pojo.research.ResearchContext;
import com.tripscout.pojo.research.category.Attraction;
import com.tripscout.pojo.research.category.EventInfo;
import com.tripscout.pojo.research.category.FlightOffer;
import com.tripscout.pojo.research.category.HotelOffer;
import com.tripscout.server.adapter.AffordabilityAdapter;
import com.tripscout.server.adapter.AttractionsAdapter;
import com.tripscout.server.adapter.CountryCodes;
import com.tripscout.server.adapter.EventsAdapter;
import com.tripscout.server.adapter.FlightsAdapter;
import com.tripscout.server.adapter.HotelsAdapter;
import com.tripscout.server.adapter.NightlifeAdapter;
import com.tripscout.server.adapter.RestaurantsAdapter;
import com.tripscout.server.adapter.TransportAdapter;
import com.tripscout.server.adapter.VisaAdapter;
import com.tripscout.server.adapter.WeatherAdapter;
import com.tripscout.server.adapter.WebResearchAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * 单个目的地的调研流程，按固定顺序依次查询各类别：
 * 天气 -> 签证 -> 景点+活动（并行）-> 消费 -> 机票+酒店（并行）-> 餐饮 -> 交通 -> 夜生活 -> 网络检索。
 *
 * 每一步前推进一次进度；类别失败不会中断流程，只会让目的地变为 partial。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DestinationResearcher {

    static final int ATTRACTIONS_LIMIT = 10;

    static final String HOTEL_ACCESSIBILITY_NOTE = "Confirm accessibility features directly with hotel";
    static final String WHEELCHAIR_TRANSPORT_NOTE = "Check wheelchair accessibility for public transport before travel";

    private static final List<String> KID_FRIENDLY_KEYWORDS =
            List.of("park", "museum", "zoo", "beach", "attraction", "theme", "nature", "garden");

    private final CategoryInvoker categoryInvoker;
    private final WeatherAdapter weatherAdapter;
    private final VisaAdapter visaAdapter;
    private final AttractionsAdapter attractionsAdapter;
    private final EventsAdapter eventsAdapter;
    private final AffordabilityAdapter affordabilityAdapter;
    private final FlightsAdapter flightsAdapter;
    private final HotelsAdapter hotelsAdapter;
    private final RestaurantsAdapter restaurantsAdapter;
    private final TransportAdapter transportAdapter;
    private final NightlifeAdapter nightlifeAdapter;
    private final WebResearchAdapter webResearchAdapter;

    /**
     * 单个目的地会推进的步骤数：固定 6 步，有出发地加机票一步，需要夜生活加一步，启用网络检索加一步。
     */
    public int stepsFor(TravelPreferencesDTO preferences) {
        int steps = 6;
        if (StringUtils.hasText(preferences.getOrigin())) {
            steps++;
        }
        if (wantsNightlife(preferences)) {
            steps++;
        }
        if (webResearchAdapter.isEnabled()) {
            steps++;
        }
        return steps;
    }

    /**
     * 调研一个目的地，返回 completed 或 partial 状态的结果（尚未打分）。
     * 类别以外的异常直接抛给调用方，由调用方把该目的地标记为 failed。
     */
    public DestinationResearch research(String destination, TravelPreferencesDTO preferences, StepTracker tracker) {
        DestinationResearch dr = new DestinationResearch(destination);
        CategoryResults c = dr.getCategories();
        String countryCode = CountryCodes.resolve(destination);
        String country = countryCode != null ? countryCode : DestinationResearch.countryOf(destination);

        tracker.advance(ResearchStep.RESEARCHING_WEATHER, "Checking weather for " + destination + "...");
        c.setWeather(await(categoryInvoker.invoke(ResearchCategory.WEATHER, dr,
                () -> weatherAdapter.currentWeather(destination, preferences.getTravelStart()))));

        tracker.advance(ResearchStep.RESEARCHING_VISA, "Checking visa requirements for " + destination + "...");
        c.setVisa(await(categoryInvoker.invoke(ResearchCategory.VISA, dr,
                () -> visaAdapter.requirements(preferences.getPassportCountry(), country))));

        String label = preferences.withKids() ? "family-friendly " : "";
        tracker.advance(ResearchStep.RESEARCHING_ATTRACTIONS, "Finding " + label + "attractions in " + destination + "...");
        CompletableFuture<List<Attraction>> attractions = categoryInvoker.invoke(ResearchCategory.ATTRACTIONS, dr,
                () -> attractionsAdapter.attractions(destination, ATTRACTIONS_LIMIT));
        CompletableFuture<List<EventInfo>> events = categoryInvoker.invoke(ResearchCategory.EVENTS, dr,
                () -> eventsAdapter.events(destination, preferences.getTravelStart(), preferences.getTravelEnd()));
        CompletableFuture.allOf(attractions, events).join();
        c.setAttractions(attractions.join());
        c.setEvents(events.join());
        if (preferences.withKids()) {
            markKidFriendly(c.getAttractions());
        }

        tracker.advance(ResearchStep.RESEARCHING_AFFORDABILITY, "Analyzing costs for " + destination + "...");
        String style = ScoringEngine.travelStyle(preferences.getBudgetLevel());
        c.setAffordability(await(categoryInvoker.invoke(ResearchCategory.AFFORDABILITY, dr,
                () -> affordabilityAdapter.estimate(country, style, preferences.tripDays()))));

        boolean hasOrigin = StringUtils.hasText(preferences.getOrigin());
        if (hasOrigin) {
            tracker.advance(ResearchStep.RESEARCHING_FLIGHTS, "Searching flights to " + destination + "...");
        }
        CompletableFuture<List<FlightOffer>> flights = hasOrigin
                ? categoryInvoker.invoke(ResearchCategory.FLIGHTS, dr,
                () -> flightsAdapter.search(preferences.getOrigin(), destination, preferences.getTravelStart()))
                : CompletableFuture.completedFuture(null);
        CompletableFuture<List<HotelOffer>> hotels = categoryInvoker.invoke(ResearchCategory.HOTELS, dr,
                () -> hotelsAdapter.search(destination, preferences.getTravelStart(), preferences.getTravelEnd(),
                        adultsOf(preferences)));
        CompletableFuture.allOf(flights, hotels).join();
        c.setFlights(flights.join());
        c.setHotels(hotels.join());
        if (preferences.needsAccessibility() && c.getHotels() != null) {
            c.getHotels().forEach(h -> h.setAccessibilityNote(HOTEL_ACCESSIBILITY_NOTE));
        }

        tracker.advance(ResearchStep.RESEARCHING_RESTAURANTS, "Finding restaurants in " + destination + "...");
        List<String> dietary = dietaryOf(preferences);
        c.setRestaurants(await(categoryInvoker.invoke(ResearchCategory.RESTAURANTS, dr,
                () -> restaurantsAdapter.guide(destination, dietary))));

        tracker.advance(ResearchStep.RESEARCHING_TRANSPORT, "Researching transport options for " + destination + "...");
        c.setTransport(await(categoryInvoker.invoke(ResearchCategory.TRANSPORT, dr,
                () -> transportAdapter.guide(destination))));
        if (c.getTransport() != null && needsWheelchair(preferences)) {
            c.getTransport().setAccessibilityNote(WHEELCHAIR_TRANSPORT_NOTE);
        }

        if (wantsNightlife(preferences)) {
            tracker.advance(ResearchStep.RESEARCHING_NIGHTLIFE, "Finding nightlife in " + destination + "...");
            c.setNightlife(await(categoryInvoker.invoke(ResearchCategory.NIGHTLIFE, dr,
                    () -> nightlifeAdapter.guide(destination))));
        }

        if (webResearchAdapter.isEnabled()) {
            tracker.advance(ResearchStep.RESEARCHING_WEB, "Researching " + destination + " online...");
            c.setWeb(await(categoryInvoker.invoke(ResearchCategory.WEB, dr,
                    () -> webResearchAdapter.research(destination, preferences.getInterests()))));
        }

        dr.setContext(ResearchContext.builder()
                .travelingWith(preferences.getTravelingWith())
                .hasKids(preferences.withKids())
                .kidsAges(preferences.getKidsAges())
                .pacePreference(preferences.getPacePreference())
                .tripType(preferences.getTripType())
                .dietaryRestrictions(dietary)
                .accessibilityNeeds(preferences.getAccessibilityNeeds())
                .build());
        dr.setStatus(dr.getFailedCategories().isEmpty() ? DestinationStatus.COMPLETED : DestinationStatus.PARTIAL);
        if (!dr.getFailedCategories().isEmpty()) {
            log.info("目的地部分类别失败, destination={}, failed={}", destination, dr.getFailedCategories());
        }
        return dr;
    }

    private <T> T await(CompletableFuture<T> future) {
        return future.join();
    }

    static boolean wantsNightlife(TravelPreferencesDTO preferences) {
        return preferences.hasInterest("nightlife") || "group".equalsIgnoreCase(preferences.getTravelingWith());
    }

    private static void markKidFriendly(List<Attraction> attractions) {
        if (attractions == null) {
            return;
        }
        for (Attraction a : attractions) {
            String type = a.getType() == null ? "" : a.getType().toLowerCase(Locale.ROOT);
            a.setKidFriendly(KID_FRIENDLY_KEYWORDS.stream().anyMatch(type::contains));
        }
    }

    private static boolean needsWheelchair(TravelPreferencesDTO preferences) {
        return preferences.getAccessibilityNeeds() != null && preferences.getAccessibilityNeeds().stream()
                .anyMatch(n -> n != null && "wheelchair".equalsIgnoreCase(n.trim()));
    }

    private static List<String> dietaryOf(TravelPreferencesDTO preferences) {
        List<String> dietary = new ArrayList<>();
        if (preferences.getDietaryRestrictions() != null) {
            for (String d : preferences.getDietaryRestrictions()) {
                if (StringUtils.hasText(d) && !"none".equalsIgnoreCase(d.trim())) {
                    dietary.add(d.trim());
                }
            }
        }
        return dietary;
    }

    private static int adultsOf(TravelPreferencesDTO preferences) {
        String with = preferences.getTravelingWith() == null ? "solo" : preferences.getTravelingWith().toLowerCase(Locale.ROOT);
        return switch (with) {
            case "couple", "family" -> 2;
            case "group" -> 4;
            default -> 1;
        };
    }
}
