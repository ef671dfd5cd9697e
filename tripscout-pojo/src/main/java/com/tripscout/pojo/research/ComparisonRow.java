package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对比表中的一行。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonRow {

    private String name;

    private Double overallScore;

    private DestinationStatus status;

    private Double temperature;

    private String weatherCondition;

    private Boolean visaRequired;

    private Integer attractionsCount;

    /** within_budget / slightly_over / over_budget / unknown */
    private String budgetFit;

    private String costLevel;

    private Integer eventsCount;

    private ScoreBreakdown scores;
}
