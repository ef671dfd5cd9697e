package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.Attraction;

import java.util.List;

/**
 * 景点数据源，结果按评分降序。
 */
public interface AttractionsAdapter {

    AdapterResult<List<Attraction>> attractions(String destination, int limit);
}
