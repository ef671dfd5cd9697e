package com.tripscout.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("research_job")
public class ResearchJob {

    /** UUID 字符串，由提交接口生成 */
    @TableId(type = IdType.INPUT)
    private String id;

    private String userId;

    /** 目前只有 destination_research */
    private String jobType;

    /**
     * pending / in_progress / completed / failed
     */
    private String status;

    /** 出行偏好 JSON */
    private String queryParams;

    private Integer totalSteps;

    private Integer completedSteps;

    private String currentStep;

    /** 调研结果 JSON，仅 completed 时存在 */
    private String results;

    /** 错误信息 JSON {error, timestamp}，仅 failed 时存在 */
    private String errors;

    private LocalDateTime createTime;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
