package com.tripscout.pojo.research;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationHighlights {

    private List<String> topAttractions = new ArrayList<>();

    private List<String> topEvents = new ArrayList<>();

    /** 最低酒店价格（每晚） */
    private Double hotelFrom;

    /** 最低机票价格 */
    private Double flightFrom;

    private String diningHighlight;

    private String signatureDish;

    private String transportTip;

    private String nightlifeHighlight;
}
