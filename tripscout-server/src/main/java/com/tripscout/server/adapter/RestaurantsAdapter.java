package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.RestaurantGuide;

import java.util.List;

/**
 * 餐饮指南，饮食限制会参与缓存 key。
 */
public interface RestaurantsAdapter {

    AdapterResult<RestaurantGuide> guide(String destination, List<String> dietaryRestrictions);
}
