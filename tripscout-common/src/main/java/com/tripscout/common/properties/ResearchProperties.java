package com.tripscout.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 目的地调研编排配置。
 * Research orchestration settings.
 */
@Data
@ConfigurationProperties(prefix = "tripscout.research")
public class ResearchProperties {

    /**
     * 单个任务最多调研的目的地数量。
     * Max destinations researched per job.
     */
    private int maxDestinations = 3;

    /**
     * 未指定目的地时，推荐候选列表的上限。
     */
    private int maxSuggestions = 8;

    /**
     * 单个数据源调用超时（毫秒），超时视为该类别失败。
     */
    private long adapterTimeoutMs = 25000;

    /**
     * 同步快速调研接口的整体超时（毫秒）。
     */
    private long quickResearchTimeoutMs = 30000;

    /**
     * 是否启用网络检索类别（需要外部检索服务）。
     */
    private boolean webResearchEnabled = false;

    /**
     * 任务线程池：核心线程数 / 最大线程数 / 队列容量。
     */
    private int jobCorePoolSize = 4;

    private int jobMaxPoolSize = 8;

    private int jobQueueCapacity = 100;

    /**
     * 数据源查询线程池：核心线程数 / 最大线程数 / 队列容量。
     */
    private int taskCorePoolSize = 8;

    private int taskMaxPoolSize = 32;

    private int taskQueueCapacity = 500;
}
