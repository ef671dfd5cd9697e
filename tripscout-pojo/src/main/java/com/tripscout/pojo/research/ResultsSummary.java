package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * completed 事件中的结果摘要。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultsSummary {

    private int destinationsCount;

    private String topDestination;

    private Double topScore;

    public static ResultsSummary of(ResearchResult result) {
        int count = result.getDestinations() == null ? 0 : result.getDestinations().size();
        if (result.getRecommendations() == null || result.getRecommendations().isEmpty()) {
            return new ResultsSummary(count, null, null);
        }
        Recommendation top = result.getRecommendations().get(0);
        return new ResultsSummary(count, top.getDestination(), top.getScore());
    }
}
