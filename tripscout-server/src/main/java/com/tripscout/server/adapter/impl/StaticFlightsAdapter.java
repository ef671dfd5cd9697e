package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.FlightOffer;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.FlightsAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 航班兜底数据源：按出发地 + 目的地生成 5 个稳定的报价，价格升序。
 */
@Component
@RequiredArgsConstructor
public class StaticFlightsAdapter implements FlightsAdapter {

    private static final String[] AIRLINES = {"AA", "DL", "UA", "BA", "LH", "AF", "KL", "EK", "QR", "SQ"};
    private static final int OFFERS = 5;

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<List<FlightOffer>> search(String origin, String destination, LocalDate departureDate) {
        if (!StringUtils.hasText(origin) || !StringUtils.hasText(destination)) {
            return AdapterResult.fail("flights", "bad_request", "origin and destination are required");
        }
        LocalDate date = departureDate == null ? LocalDate.now().plusDays(30) : departureDate;
        String key = CacheClient.buildKey(RedisConstants.CACHE_FLIGHTS_KEY, origin, destination, date);
        List<FlightOffer> offers = cacheClient.queryWithPassThrough(key, new TypeReference<List<FlightOffer>>() {
                }, () -> generate(origin, destination, date),
                RedisConstants.CACHE_FLIGHTS_TTL_MINUTES, TimeUnit.MINUTES);
        return AdapterResult.ok(offers);
    }

    private List<FlightOffer> generate(String origin, String destination, LocalDate date) {
        int seed = Math.floorMod((origin.toLowerCase(Locale.ROOT) + "|" + destination.toLowerCase(Locale.ROOT)).hashCode(), 1000);
        double baseDuration = 4 + seed % 12;
        double basePrice = 250 + seed % 400;
        List<FlightOffer> offers = new ArrayList<>();
        for (int i = 0; i < OFFERS; i++) {
            String airline = AIRLINES[(seed + i * 3) % AIRLINES.length];
            int stops = i % 3 == 0 ? 0 : 1;
            offers.add(FlightOffer.builder()
                    .airline(airline)
                    .flightNumber(airline + (100 + (seed + i * 37) % 900))
                    .origin(origin)
                    .destination(destination)
                    .departureDate(date)
                    .stops(stops)
                    .durationHours(baseDuration + stops * 2.5 + i * 0.5)
                    .price(basePrice + i * 85 - stops * 60)
                    .build());
        }
        offers.sort(Comparator.comparing(FlightOffer::getPrice));
        return offers;
    }
}
