package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 调研任务的完整结果，completed 时落库为 results。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchResult {

    private TravelPreferencesDTO preferences;

    private LocalDateTime researchTimestamp;

    /** 未指定目的地时自动推荐的候选列表 */
    private List<String> suggestedDestinations;

    private List<DestinationResearch> destinations = new ArrayList<>();

    private List<ComparisonRow> comparison = new ArrayList<>();

    private List<Recommendation> recommendations = new ArrayList<>();
}
