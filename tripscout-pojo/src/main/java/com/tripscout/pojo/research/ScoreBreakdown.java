package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 六项子评分（0-100）及加权总分。
 * overall = 0.20 天气 + 0.25 消费 + 0.15 签证 + 0.20 景点 + 0.10 活动 + 0.10 兴趣匹配
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {

    public static final double WEATHER_WEIGHT = 0.20;
    public static final double AFFORDABILITY_WEIGHT = 0.25;
    public static final double VISA_WEIGHT = 0.15;
    public static final double ATTRACTIONS_WEIGHT = 0.20;
    public static final double EVENTS_WEIGHT = 0.10;
    public static final double INTEREST_WEIGHT = 0.10;

    private double weather;

    private double affordability;

    private double visa;

    private double attractions;

    private double events;

    private double interestAlignment;

    private double overall;

    public static ScoreBreakdown of(double weather, double affordability, double visa,
                                    double attractions, double events, double interestAlignment) {
        double overall = weather * WEATHER_WEIGHT
                + affordability * AFFORDABILITY_WEIGHT
                + visa * VISA_WEIGHT
                + attractions * ATTRACTIONS_WEIGHT
                + events * EVENTS_WEIGHT
                + interestAlignment * INTEREST_WEIGHT;
        return new ScoreBreakdown(weather, affordability, visa, attractions, events, interestAlignment,
                Math.round(overall * 10.0) / 10.0);
    }
}
