package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 目的地消费水平。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffordabilityInfo {

    private String countryCode;

    /** 消费指数，美国约为 100 */
    private Integer costIndex;

    /** budget / moderate / comfort / luxury */
    private String costLevel;

    /** 与出行风格对应的日均花费（美元） */
    private Double dailyCost;

    /** 各出行风格的日均花费 */
    private Map<String, Double> dailyBudget;

    /** 日均花费构成：accommodation / food / transport / activities */
    private Map<String, Double> breakdown;

    /** 整趟行程估算（美元） */
    private Double estimatedTripCost;
}
