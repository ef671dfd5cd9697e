package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.NightlifeGuide;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.NightlifeAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 夜生活指南。
 */
@Component
@RequiredArgsConstructor
public class StaticNightlifeAdapter implements NightlifeAdapter {

    /** 城市 -> {区域(;分隔), 类型(;分隔), 亮点} */
    private static final Map<String, String[]> NIGHTLIFE = new LinkedHashMap<>();

    static {
        NIGHTLIFE.put("tokyo", new String[]{"Shibuya;Shinjuku;Roppongi;Golden Gai;Ebisu",
                "Izakayas;Karaoke;Clubs;Jazz bars", "Tiny bars in Golden Gai, karaoke everywhere"});
        NIGHTLIFE.put("bangkok", new String[]{"Khao San Road;Sukhumvit;Thonglor;RCA;Chinatown",
                "Rooftop bars;Nightclubs;Street bars;Live music", "Rooftop bars and street-side drinking"});
        NIGHTLIFE.put("berlin", new String[]{"Kreuzberg;Friedrichshain;Neukölln;Mitte",
                "Techno clubs;Beer gardens;Live music;Alternative bars", "Legendary techno clubs open all weekend"});
        NIGHTLIFE.put("ibiza", new String[]{"Ibiza Town;San Antonio;Playa d'en Bossa",
                "Superclubs;Beach clubs;Sunset bars;Boat parties", "World-class DJs and sunset sessions"});
        NIGHTLIFE.put("new york", new String[]{"Lower East Side;Williamsburg;Meatpacking;East Village",
                "Speakeasies;Rooftop bars;Jazz clubs;Dive bars", "Rooftop views and historic jazz clubs"});
        NIGHTLIFE.put("london", new String[]{"Soho;Shoreditch;Camden;Brixton",
                "Pubs;Cocktail bars;Clubs;Live music venues", "Historic pubs and a diverse music scene"});
        NIGHTLIFE.put("las vegas", new String[]{"The Strip;Downtown/Fremont St",
                "Mega clubs;Pool parties;Casino bars;Shows", "DJ residencies and pool parties"});
        NIGHTLIFE.put("rio de janeiro", new String[]{"Lapa;Ipanema;Copacabana;Leblon",
                "Samba clubs;Beach kiosks;Live music;Street parties", "Samba nights and street parties"});
    }

    private static final String[] GENERAL = {"City center",
            "Bars;Live music", "Discover local favorites"};

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<NightlifeGuide> guide(String destination) {
        String key = CacheClient.buildKey(RedisConstants.CACHE_NIGHTLIFE_KEY, destination);
        NightlifeGuide guide = cacheClient.queryWithPassThrough(key, new TypeReference<NightlifeGuide>() {
                }, () -> {
                    String[] row = CityGuides.match(NIGHTLIFE, destination, GENERAL);
                    return NightlifeGuide.builder()
                            .districts(Arrays.asList(row[0].split(";")))
                            .venues(Arrays.asList(row[1].split(";")))
                            .highlight(row[2])
                            .build();
                },
                RedisConstants.CACHE_CITY_GUIDE_TTL_HOURS, TimeUnit.HOURS);
        return AdapterResult.ok(guide);
    }
}
