package com.tripscout.pojo.vo;

import lombok.Data;

import java.util.List;

/**
 * 前端表单可选项。
 */
@Data
public class ResearchOptionsVO {

    private List<String> budgetLevels;

    private List<String> travelStyles;

    private List<String> visaPreferences;

    private List<String> weatherPreferences;

    private List<String> interests;

    private List<String> pacePreferences;

    private List<Integer> maxFlightDurationOptions;
}
