package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.TransportGuide;

/**
 * 当地交通指南。
 */
public interface TransportAdapter {

    AdapterResult<TransportGuide> guide(String destination);
}
