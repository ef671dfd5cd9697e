package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.VisaInfo;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.VisaAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于本地签证规则表的签证数据源。
 * 未收录的组合按「需要签证，请咨询使馆」返回。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaticVisaAdapter implements VisaAdapter {

    private static final Map<String, VisaInfo> RULES = new HashMap<>();

    static {
        free("US", "FR", 90, "Schengen", "90 days within 180-day period");
        free("US", "JP", 90, null, "Tourist stay up to 90 days");
        required("US", "ID", true, 3, 35.0, "e-VOA", "Visa on arrival or e-VOA available");
        free("US", "GB", 180, null, "Up to 6 months as tourist");
        free("US", "AE", 30, null, "Visa on arrival, extendable");
        free("US", "SG", 90, null, "Up to 90 days");
        required("US", "AU", true, 1, 20.0, "ETA", "Electronic Travel Authority");
        free("US", "IT", 90, "Schengen", "90 days within 180-day period");
        free("US", "ES", 90, "Schengen", "90 days within 180-day period");
        free("US", "ZA", 90, null, "Up to 90 days");
        free("US", "MA", 90, null, "Up to 90 days");
        free("US", "TH", 30, null, "Visa exemption for tourism");
        required("US", "TR", true, 1, 50.0, "e-Visa", "Apply online before travel");
        free("US", "IS", 90, "Schengen", "90 days within 180-day period");
        required("US", "BR", true, 5, 44.0, "e-Visa", "Apply online before travel");
        required("US", "EG", true, 3, 25.0, "e-Visa", "Single entry, valid for 3 months");
        free("US", "CZ", 90, "Schengen", "90 days within 180-day period");
        required("US", "NZ", true, 3, 12.0, "NZeTA", "NZ Electronic Travel Authority");
        free("FR", "US", 90, "ESTA", "ESTA required for visa waiver");
        free("GB", "US", 90, "ESTA", "ESTA required for visa waiver");
        free("DE", "US", 90, "ESTA", "ESTA required for visa waiver");
        free("JP", "US", 90, "ESTA", "ESTA required");
        free("JP", "FR", 90, "Schengen", "90 days within 180-day period");
        required("CN", "US", false, 3, 140.0, "B1/B2", "Interview required at US Embassy");
        required("IN", "US", false, 3, 160.0, "B1/B2", "Interview required");
    }

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<VisaInfo> requirements(String passportCountry, String destinationCountry) {
        String passport = passportCountry == null ? "US" : passportCountry.trim().toUpperCase(Locale.ROOT);
        String dest = destinationCountry == null ? "" : destinationCountry.trim().toUpperCase(Locale.ROOT);
        if (passport.equals(dest)) {
            return AdapterResult.ok(VisaInfo.builder()
                    .passportCountry(passport)
                    .destinationCountry(dest)
                    .visaRequired(false)
                    .visaType("domestic")
                    .evisaAvailable(false)
                    .notes("Domestic travel")
                    .build());
        }
        String key = CacheClient.buildKey(RedisConstants.CACHE_VISA_KEY, passport, dest);
        VisaInfo info = cacheClient.queryWithPassThrough(key, new TypeReference<VisaInfo>() {
                }, () -> lookup(passport, dest),
                RedisConstants.CACHE_VISA_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(info);
    }

    private VisaInfo lookup(String passport, String dest) {
        VisaInfo rule = RULES.get(passport + ":" + dest);
        if (rule == null) {
            log.debug("签证规则未收录: passport={}, destination={}", passport, dest);
            return VisaInfo.builder()
                    .passportCountry(passport)
                    .destinationCountry(dest)
                    .visaRequired(true)
                    .visaType("embassy")
                    .evisaAvailable(false)
                    .notes("Please check with the embassy for current requirements")
                    .build();
        }
        return rule;
    }

    private static void free(String passport, String dest, int days, String type, String notes) {
        RULES.put(passport + ":" + dest, VisaInfo.builder()
                .passportCountry(passport)
                .destinationCountry(dest)
                .visaRequired(false)
                .visaType(type == null ? "visa_free" : type)
                .evisaAvailable(false)
                .maxStayDays(days)
                .notes(notes)
                .build());
    }

    private static void required(String passport, String dest, boolean evisa, int processingDays,
                                 Double cost, String type, String notes) {
        RULES.put(passport + ":" + dest, VisaInfo.builder()
                .passportCountry(passport)
                .destinationCountry(dest)
                .visaRequired(true)
                .visaType(type)
                .evisaAvailable(evisa)
                .processingDays(processingDays)
                .costUsd(cost)
                .notes(notes)
                .build());
    }
}
