package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 目的地调研时的同行人、节奏、饮食与无障碍信息，用于生成推荐理由。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchContext {

    private String travelingWith;

    private boolean hasKids;

    private List<Integer> kidsAges;

    private String pacePreference;

    private String tripType;

    private List<String> dietaryRestrictions;

    private List<String> accessibilityNeeds;
}
