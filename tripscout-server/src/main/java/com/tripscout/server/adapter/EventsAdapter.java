package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.EventInfo;

import java.time.LocalDate;
import java.util.List;

/**
 * 活动数据源，只返回出行窗口内的活动。
 */
public interface EventsAdapter {

    AdapterResult<List<EventInfo>> events(String destination, LocalDate start, LocalDate end);
}
