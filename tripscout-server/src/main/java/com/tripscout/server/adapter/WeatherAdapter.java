package com.tripscout.server.adapter;

import com.tripscout.pojo.research.category.WeatherInfo;

import java.time.LocalDate;

/**
 * 天气数据源。
 */
public interface WeatherAdapter {

    AdapterResult<WeatherInfo> currentWeather(String destination, LocalDate date);
}
