package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.VisaInfo;

/**
 * 签证规则数据源，国家使用 ISO 3166-1 alpha-2 代码。
 */
public interface VisaAdapter {

    AdapterResult<VisaInfo> requirements(String passportCountry, String destinationCountry);
}
