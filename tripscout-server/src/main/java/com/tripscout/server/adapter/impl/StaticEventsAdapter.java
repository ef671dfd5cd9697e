package com.tripscout.server.adapter.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.category.EventInfo;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.adapter.EventsAdapter;
import com.tripscout.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 活动兜底数据源：在出行窗口内每隔两天排一场活动，最多 5 场。
 */
@Component
@RequiredArgsConstructor
public class StaticEventsAdapter implements EventsAdapter {

    private static final int MAX_EVENTS = 5;

    /** {名称模板, 类别, 场地} */
    private static final String[][] TEMPLATES = {
            {"%s Music Festival", "music", "City Arena"},
            {"%s Food & Wine Fair", "food", "Harbour Market"},
            {"Summer Jazz Nights", "music", "Old Town Square"},
            {"%s City Marathon", "sports", "Central Park"},
            {"Contemporary Art Week", "arts", "Modern Art Gallery"}
    };

    private final CacheClient cacheClient;

    @Override
    public AdapterResult<List<EventInfo>> events(String destination, LocalDate start, LocalDate end) {
        LocalDate from = start == null ? LocalDate.now().plusDays(30) : start;
        LocalDate to = end == null || end.isBefore(from) ? from.plusDays(7) : end;
        String key = CacheClient.buildKey(RedisConstants.CACHE_EVENTS_KEY, destination, from, to);
        List<EventInfo> events = cacheClient.queryWithPassThrough(key, new TypeReference<List<EventInfo>>() {
                }, () -> generate(DestinationResearch.cityOf(destination), from, to),
                RedisConstants.CACHE_EVENTS_TTL_MINUTES, TimeUnit.MINUTES);
        return AdapterResult.ok(events);
    }

    private List<EventInfo> generate(String city, LocalDate from, LocalDate to) {
        List<EventInfo> events = new ArrayList<>();
        for (int i = 0; i < MAX_EVENTS; i++) {
            LocalDate date = from.plusDays(2L * i);
            if (date.isAfter(to)) {
                break;
            }
            String[] t = TEMPLATES[i];
            events.add(EventInfo.builder()
                    .name(String.format(t[0], city))
                    .category(t[1])
                    .venue(t[2])
                    .date(date)
                    .build());
        }
        return events;
    }
}
