package com.tripscout.pojo.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 调研任务状态 VO，提交接口与状态查询接口共用。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchJobVO {

    private String jobId;

    private String status;

    private Integer progressPercentage;

    private String currentStep;

    private Integer completedSteps;

    private Integer totalSteps;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private Integer destinationsCount;

    private boolean resultsAvailable;

    /** 仅 failed 时存在 */
    private String error;
}
