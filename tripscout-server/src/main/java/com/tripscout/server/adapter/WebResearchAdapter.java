package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.WebResearchSummary;

import java.util.List;

/**
 * 网络检索数据源，未启用时编排器不会调用，也不计入步骤。
 */
public interface WebResearchAdapter {

    boolean isEnabled();

    AdapterResult<WebResearchSummary> research(String destination, List<String> interests);
}
