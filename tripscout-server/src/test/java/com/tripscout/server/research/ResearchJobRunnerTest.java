package com.tripscout.server.research;

import com.tripscout.common.exception.BaseException;
import com.tripscout.common.exception.ResearchException;
import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.common.result.ErrorCode;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.server.metrics.MetricsRecorder;
import com.tripscout.server.research.progress.ProgressSink;
import com.tripscout.server.service.ResearchJobService;
import com.tripscout.server.ws.ResearchEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResearchJobRunner 单元测试：任务结果指标、MDC 清理、线程池拒绝与快速调研超时。
 */
@ExtendWith(MockitoExtension.class)
class ResearchJobRunnerTest {

    @Mock
    private ResearchOrchestrator researchOrchestrator;
    @Mock
    private ResearchJobService researchJobService;
    @Mock
    private ResearchEventPublisher researchEventPublisher;
    @Mock
    private MetricsRecorder metricsRecorder;

    private ResearchProperties properties;
    private ThreadPoolTaskExecutor executor;
    private ResearchJobRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
        runner = new ResearchJobRunner(researchOrchestrator, researchJobService, researchEventPublisher,
                properties, metricsRecorder, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void execute_shouldRecordCompletedAndClearMdc() {
        TravelPreferencesDTO preferences = new TravelPreferencesDTO();

        runner.execute("job-1", preferences, ProgressSink.NOOP);

        verify(researchOrchestrator).run("job-1", preferences, ProgressSink.NOOP);
        verify(metricsRecorder).recordJobOutcome("completed");
        assertNull(MDC.get(ResearchJobRunner.MDC_JOB_ID));
    }

    @Test
    void execute_shouldRecordFailed_whenOrchestratorFails() {
        TravelPreferencesDTO preferences = new TravelPreferencesDTO();
        when(researchOrchestrator.run("job-2", preferences, ProgressSink.NOOP))
                .thenThrow(new ResearchException("boom"));

        runner.execute("job-2", preferences, ProgressSink.NOOP);

        verify(metricsRecorder).recordJobOutcome("failed");
    }

    @Test
    void submit_shouldMarkFailed_whenQueueRejects() {
        ThreadPoolTaskExecutor full = mock(ThreadPoolTaskExecutor.class);
        doThrow(new TaskRejectedException("queue full")).when(full).execute(any(Runnable.class));
        ResearchJobRunner rejecting = new ResearchJobRunner(researchOrchestrator, researchJobService,
                researchEventPublisher, properties, metricsRecorder, full);
        ResearchJob job = new ResearchJob();
        job.setId("job-3");

        assertThrows(ResearchException.class, () -> rejecting.submit(job, new TravelPreferencesDTO()));
        verify(researchJobService).markFailed("job-3", "Research queue is full");
        verify(metricsRecorder).recordJobOutcome("rejected");
    }

    @Test
    void quickResearch_shouldReturnFirstDestination() {
        ResearchResult result = new ResearchResult();
        result.getDestinations().add(new DestinationResearch("Lisbon, Portugal"));
        when(researchOrchestrator.run(isNull(), any(TravelPreferencesDTO.class), eq(ProgressSink.NOOP)))
                .thenReturn(result);

        DestinationResearch d = runner.quickResearch("Lisbon, Portugal", List.of("food"));

        assertEquals("Lisbon, Portugal", d.getName());
    }

    @Test
    void quickResearch_shouldThrowTimeout_whenTooSlow() {
        properties.setQuickResearchTimeoutMs(50);
        when(researchOrchestrator.run(isNull(), any(TravelPreferencesDTO.class), eq(ProgressSink.NOOP)))
                .thenAnswer(inv -> {
                    Thread.sleep(2000);
                    return new ResearchResult();
                });

        BaseException ex = assertThrows(BaseException.class, () -> runner.quickResearch("Oslo, Norway", null));
        assertEquals(ErrorCode.RESEARCH_TIMEOUT.getCode(), ex.getCode());
    }
}
