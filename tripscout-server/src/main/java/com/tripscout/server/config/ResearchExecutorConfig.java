package com.tripscout.server.config;

import com.tripscout.common.properties.ResearchProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 调研相关线程池：
 * - researchJobExecutor：每个任务占用一个线程，串行推进各步骤；
 * - researchTaskExecutor：单个目的地内并行查询各数据源。
 *
 * 两个池分开，避免数据源查询把任务线程占满导致互相等待。
 */
@Configuration
@RequiredArgsConstructor
public class ResearchExecutorConfig {

    public static final String JOB_EXECUTOR = "researchJobExecutor";
    public static final String TASK_EXECUTOR = "researchTaskExecutor";

    private final ResearchProperties researchProperties;

    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor researchJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(researchProperties.getJobCorePoolSize());
        executor.setMaxPoolSize(researchProperties.getJobMaxPoolSize());
        executor.setQueueCapacity(researchProperties.getJobQueueCapacity());
        executor.setThreadNamePrefix("research-job-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = TASK_EXECUTOR)
    public ThreadPoolTaskExecutor researchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(researchProperties.getTaskCorePoolSize());
        executor.setMaxPoolSize(researchProperties.getTaskMaxPoolSize());
        executor.setQueueCapacity(researchProperties.getTaskQueueCapacity());
        executor.setThreadNamePrefix("research-task-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        // 默认 AbortPolicy，拒绝时由 CategoryInvoker 立即把类别记为失败
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 把提交线程的 MDC（traceId / jobId）带到工作线程。
     */
    static TaskDecorator mdcTaskDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                } else {
                    MDC.clear();
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
