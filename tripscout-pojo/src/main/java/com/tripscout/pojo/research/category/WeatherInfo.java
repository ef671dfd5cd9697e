package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 天气类别数据。温度单位为摄氏度。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherInfo {

    private Double temperature;

    /**
     * 主天气状况：Clear / Clouds / Rain / Snow / Thunderstorm / Drizzle / Mist
     */
    private String condition;

    private String description;

    private Integer humidity;

    private Double windSpeed;

    /** openweather 或 climate_estimate */
    private String source;
}
