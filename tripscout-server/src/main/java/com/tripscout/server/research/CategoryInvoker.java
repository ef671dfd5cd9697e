package com.tripscout.server.research;

import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.ResearchCategory;
import com.tripscout.server.adapter.AdapterResult;
import com.tripscout.server.config.ResearchExecutorConfig;
import com.tripscout.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 单个类别的数据源调用包装。
 *
 * 在数据源线程池上执行，带超时；线程池拒绝、数据源返回失败、抛异常或超时都只会让该类别为空，
 * 并把类别记入目的地的 failedCategories，返回的 future 不会异常完成。
 */
@Component
@Slf4j
public class CategoryInvoker {

    private final Executor taskExecutor;
    private final ResearchProperties researchProperties;
    private final MetricsRecorder metricsRecorder;

    public CategoryInvoker(@Qualifier(ResearchExecutorConfig.TASK_EXECUTOR) Executor taskExecutor,
                           ResearchProperties researchProperties,
                           MetricsRecorder metricsRecorder) {
        this.taskExecutor = taskExecutor;
        this.researchProperties = researchProperties;
        this.metricsRecorder = metricsRecorder;
    }

    public <T> CompletableFuture<T> invoke(ResearchCategory category, DestinationResearch destination,
                                           Supplier<AdapterResult<T>> call) {
        long start = System.currentTimeMillis();
        String name = category.getValue();
        CompletableFuture<AdapterResult<T>> submitted;
        try {
            submitted = CompletableFuture.supplyAsync(call, taskExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("数据源线程池已满, destination={}, category={}", destination.getName(), name);
            metricsRecorder.recordAdapterCall(name, "rejected", System.currentTimeMillis() - start);
            markFailed(destination, category);
            return CompletableFuture.completedFuture(null);
        }
        return submitted
                .orTimeout(researchProperties.getAdapterTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    long latency = System.currentTimeMillis() - start;
                    if (ex != null) {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                        boolean timeout = cause instanceof TimeoutException;
                        log.warn("数据源调用{}, destination={}, category={}, err={}",
                                timeout ? "超时" : "异常", destination.getName(), name, cause.toString());
                        metricsRecorder.recordAdapterCall(name, timeout ? "timeout" : "fail", latency);
                        markFailed(destination, category);
                        return null;
                    }
                    if (result == null || !result.isOk()) {
                        log.warn("数据源返回失败, destination={}, category={}, err={}",
                                destination.getName(), name, result == null ? "null result" : result.getError());
                        metricsRecorder.recordAdapterCall(name, "fail", latency);
                        markFailed(destination, category);
                        return null;
                    }
                    metricsRecorder.recordAdapterCall(name, "success", latency);
                    return result.getValue();
                });
    }

    /**
     * 同一目的地的多个类别会在不同线程上完成。
     */
    private void markFailed(DestinationResearch destination, ResearchCategory category) {
        synchronized (destination) {
            destination.markCategoryFailed(category);
        }
    }
}
