package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private int rank;

    private String destination;

    private Double score;

    private List<String> reasons;

    private RecommendationHighlights highlights;

    /** 整趟行程估算（美元），缺少消费数据时为 null */
    private Double estimatedCost;
}
