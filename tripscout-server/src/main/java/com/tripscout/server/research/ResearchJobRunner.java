package com.tripscout.server.research;

import com.tripscout.common.exception.BaseException;
import com.tripscout.common.exception.ResearchException;
import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.common.result.ErrorCode;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.server.config.ResearchExecutorConfig;
import com.tripscout.server.metrics.MetricsRecorder;
import com.tripscout.server.research.progress.CompositeProgressSink;
import com.tripscout.server.research.progress.EventChannelProgressSink;
import com.tripscout.server.research.progress.JobStoreProgressSink;
import com.tripscout.server.research.progress.ProgressSink;
import com.tripscout.server.service.ResearchJobService;
import com.tripscout.server.ws.ResearchEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 把调研任务提交到任务线程池执行，并负责同步快速调研。
 */
@Component
@Slf4j
public class ResearchJobRunner {

    public static final String MDC_JOB_ID = "jobId";

    private final ResearchOrchestrator researchOrchestrator;
    private final ResearchJobService researchJobService;
    private final ResearchEventPublisher researchEventPublisher;
    private final ResearchProperties researchProperties;
    private final MetricsRecorder metricsRecorder;
    private final ThreadPoolTaskExecutor jobExecutor;

    public ResearchJobRunner(ResearchOrchestrator researchOrchestrator,
                             ResearchJobService researchJobService,
                             ResearchEventPublisher researchEventPublisher,
                             ResearchProperties researchProperties,
                             MetricsRecorder metricsRecorder,
                             @Qualifier(ResearchExecutorConfig.JOB_EXECUTOR) ThreadPoolTaskExecutor jobExecutor) {
        this.researchOrchestrator = researchOrchestrator;
        this.researchJobService = researchJobService;
        this.researchEventPublisher = researchEventPublisher;
        this.researchProperties = researchProperties;
        this.metricsRecorder = metricsRecorder;
        this.jobExecutor = jobExecutor;
    }

    /**
     * 异步执行一个已落库的任务。线程池拒绝时任务直接标记为 failed。
     */
    public void submit(ResearchJob job, TravelPreferencesDTO preferences) {
        ProgressSink sink = CompositeProgressSink.of(
                new JobStoreProgressSink(researchJobService),
                new EventChannelProgressSink(researchEventPublisher, job.getUserId()));
        try {
            jobExecutor.execute(() -> execute(job.getId(), preferences, sink));
        } catch (TaskRejectedException e) {
            log.error("调研任务队列已满, jobId={}", job.getId(), e);
            researchJobService.markFailed(job.getId(), "Research queue is full");
            metricsRecorder.recordJobOutcome("rejected");
            throw new ResearchException("调研任务队列已满，请稍后再试", e);
        }
    }

    void execute(String jobId, TravelPreferencesDTO preferences, ProgressSink sink) {
        MDC.put(MDC_JOB_ID, jobId);
        try {
            researchOrchestrator.run(jobId, preferences, sink);
            metricsRecorder.recordJobOutcome("completed");
        } catch (ResearchException e) {
            // 编排器已经把任务标记为 failed 并推送了错误事件
            metricsRecorder.recordJobOutcome("failed");
            log.warn("调研任务结束于失败状态, jobId={}, err={}", jobId, e.getMessage());
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    /**
     * 同步调研单个目的地，不落库、不推送，超时抛出 RESEARCH_TIMEOUT。
     */
    public DestinationResearch quickResearch(String destination, List<String> interests) {
        TravelPreferencesDTO preferences = new TravelPreferencesDTO();
        preferences.setDestinations(new ArrayList<>(List.of(destination)));
        preferences.setInterests(interests == null ? new ArrayList<>() : new ArrayList<>(interests));
        preferences.setBudgetLevel("moderate");

        CompletableFuture<ResearchResult> future = CompletableFuture.supplyAsync(
                () -> researchOrchestrator.run(null, preferences, ProgressSink.NOOP), jobExecutor);
        try {
            ResearchResult result = future.get(researchProperties.getQuickResearchTimeoutMs(), TimeUnit.MILLISECONDS);
            return result.getDestinations().isEmpty() ? null : result.getDestinations().get(0);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("快速调研超时, destination={}", destination);
            throw new BaseException(ErrorCode.RESEARCH_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof BaseException) {
                throw (BaseException) cause;
            }
            throw new ResearchException("快速调研失败: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException("快速调研被中断", e);
        }
    }
}
