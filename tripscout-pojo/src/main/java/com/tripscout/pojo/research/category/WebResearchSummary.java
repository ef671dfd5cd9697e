package com.tripscout.pojo.research.category;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 网络检索摘要。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebResearchSummary {

    private String summary;

    private List<String> sources;
}
