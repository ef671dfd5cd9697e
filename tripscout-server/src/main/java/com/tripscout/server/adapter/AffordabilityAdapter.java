package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.AffordabilityInfo;

/**
 * 消费水平数据源。travelStyle 取值 budget / moderate / comfort / luxury。
 */
public interface AffordabilityAdapter {

    AdapterResult<AffordabilityInfo> estimate(String destinationCountry, String travelStyle, int days);
}
