package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.NightlifeGuide;

/**
 * 夜生活指南。
 */
public interface NightlifeAdapter {

    AdapterResult<NightlifeGuide> guide(String destination);
}
