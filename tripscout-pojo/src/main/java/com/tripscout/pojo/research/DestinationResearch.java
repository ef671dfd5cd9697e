package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个候选目的地的调研记录。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DestinationResearch {

    private String name;

    private DestinationStatus status = DestinationStatus.RESEARCHING;

    private CategoryResults categories = new CategoryResults();

    private Double overallScore;

    private ScoreBreakdown scores;

    private ResearchContext context;

    /** 查询失败的类别 */
    private List<ResearchCategory> failedCategories = new ArrayList<>();

    /** 仅 failed 时存在 */
    private String error;

    public DestinationResearch(String name) {
        this.name = name;
    }

    public void markCategoryFailed(ResearchCategory category) {
        if (!failedCategories.contains(category)) {
            failedCategories.add(category);
        }
    }

    /**
     * 国家部分：取最后一个逗号之后的内容，例如 "Bali, Indonesia" -> "Indonesia"。
     */
    public static String countryOf(String destination) {
        if (destination == null) {
            return "";
        }
        int idx = destination.lastIndexOf(',');
        return idx >= 0 ? destination.substring(idx + 1).trim() : destination.trim();
    }

    /**
     * 城市部分：第一个逗号之前的内容。
     */
    public static String cityOf(String destination) {
        if (destination == null) {
            return "";
        }
        int idx = destination.indexOf(',');
        return idx >= 0 ? destination.substring(0, idx).trim() : destination.trim();
    }
}
