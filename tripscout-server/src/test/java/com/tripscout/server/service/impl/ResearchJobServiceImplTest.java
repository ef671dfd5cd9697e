package com.tripscout.server.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.common.exception.BaseException;
import com.tripscout.common.result.ErrorCode;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.Recommendation;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.vo.ResearchJobVO;
import com.tripscout.server.mapper.ResearchJobMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResearchJobServiceImpl 的基础单元测试：
 * - 创建任务时的初始状态；
 * - 状态查询中的百分比、目的地数量与错误信息；
 * - 结果读取的各种异常分支；
 * - 状态流转委托给带条件的 SQL，终态后的更新只记日志。
 *
 * Mapper 用 Mockito 模拟，不依赖数据库。
 */
@ExtendWith(MockitoExtension.class)
class ResearchJobServiceImplTest {

    @Mock
    private ResearchJobMapper researchJobMapper;

    private ObjectMapper objectMapper;
    private ResearchJobServiceImpl service;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        service = new ResearchJobServiceImpl(objectMapper);
        ReflectionTestUtils.setField(service, "baseMapper", researchJobMapper);
    }

    @Test
    void createJob_shouldInsertPendingJob() throws Exception {
        TravelPreferencesDTO preferences = new TravelPreferencesDTO();
        preferences.setDestinations(new ArrayList<>(List.of("Bali, Indonesia", "Tokyo, Japan")));

        ResearchJob job = service.createJob("user-1", preferences);

        ArgumentCaptor<ResearchJob> captor = ArgumentCaptor.forClass(ResearchJob.class);
        verify(researchJobMapper).insert(captor.capture());
        ResearchJob inserted = captor.getValue();
        assertEquals(job.getId(), inserted.getId());
        assertEquals("pending", inserted.getStatus());
        assertEquals(ResearchJobServiceImpl.JOB_TYPE, inserted.getJobType());
        assertEquals("initializing", inserted.getCurrentStep());
        assertEquals(0, inserted.getCompletedSteps());
        TravelPreferencesDTO stored = objectMapper.readValue(inserted.getQueryParams(), TravelPreferencesDTO.class);
        assertEquals(2, stored.getDestinations().size());
    }

    @Test
    void getJob_shouldThrowNotFound_whenMissing() {
        when(researchJobMapper.selectById("nope")).thenReturn(null);

        BaseException ex = assertThrows(BaseException.class, () -> service.getJob("nope"));
        assertEquals(ErrorCode.JOB_NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    void getStatus_shouldReportProgressAndDestinationCount() throws Exception {
        TravelPreferencesDTO preferences = new TravelPreferencesDTO();
        preferences.setDestinations(new ArrayList<>(List.of("Bali, Indonesia")));
        ResearchJob job = job("job-1", "in_progress");
        job.setQueryParams(objectMapper.writeValueAsString(preferences));
        job.setTotalSteps(9);
        job.setCompletedSteps(3);
        job.setCurrentStep("researching_visa");
        when(researchJobMapper.selectById("job-1")).thenReturn(job);

        ResearchJobVO vo = service.getStatus("job-1");

        assertEquals(33, vo.getProgressPercentage());
        assertEquals("researching_visa", vo.getCurrentStep());
        assertEquals(1, vo.getDestinationsCount());
        assertFalse(vo.isResultsAvailable());
        assertNull(vo.getError());
    }

    @Test
    void getStatus_shouldExtractErrorMessage_whenFailed() {
        ResearchJob job = job("job-2", "failed");
        job.setErrors("{\"error\":\"compile exploded\",\"timestamp\":\"2026-10-19T10:00:00\"}");
        when(researchJobMapper.selectById("job-2")).thenReturn(job);

        ResearchJobVO vo = service.getStatus("job-2");

        assertEquals("compile exploded", vo.getError());
        assertEquals(0, vo.getDestinationsCount());
    }

    @Test
    void getStatus_shouldReportFullProgress_whenCompleted() {
        ResearchJob job = job("job-3", "completed");
        job.setTotalSteps(9);
        job.setCompletedSteps(8);
        job.setResults("{}");
        when(researchJobMapper.selectById("job-3")).thenReturn(job);

        ResearchJobVO vo = service.getStatus("job-3");

        assertEquals(100, vo.getProgressPercentage());
        assertTrue(vo.isResultsAvailable());
    }

    @Test
    void getResults_shouldThrow_whenJobNotCompleted() {
        when(researchJobMapper.selectById("job-4")).thenReturn(job("job-4", "in_progress"));

        BaseException ex = assertThrows(BaseException.class, () -> service.getResults("job-4"));
        assertEquals(ErrorCode.JOB_NOT_COMPLETED.getCode(), ex.getCode());
        assertTrue(ex.getMessage().contains("in_progress"));
    }

    @Test
    void getResults_shouldThrow_whenResultsMissingOrCorrupted() {
        when(researchJobMapper.selectById("job-5")).thenReturn(job("job-5", "completed"));
        ResearchJob corrupted = job("job-6", "completed");
        corrupted.setResults("{broken");
        when(researchJobMapper.selectById("job-6")).thenReturn(corrupted);

        assertEquals(ErrorCode.JOB_RESULTS_MISSING.getCode(),
                assertThrows(BaseException.class, () -> service.getResults("job-5")).getCode());
        assertEquals(ErrorCode.JOB_RESULTS_CORRUPTED.getCode(),
                assertThrows(BaseException.class, () -> service.getResults("job-6")).getCode());
    }

    @Test
    void getResults_shouldReadStoredResult() throws Exception {
        ResearchResult stored = new ResearchResult();
        stored.setRecommendations(List.of(Recommendation.builder()
                .rank(1).destination("Bali, Indonesia").score(84.8).reasons(List.of("Fits your budget")).build()));
        ResearchJob job = job("job-7", "completed");
        job.setResults(objectMapper.writeValueAsString(stored));
        when(researchJobMapper.selectById("job-7")).thenReturn(job);

        ResearchResult result = service.getResults("job-7");

        assertEquals("Bali, Indonesia", result.getRecommendations().get(0).getDestination());
    }

    @Test
    void markFailed_shouldStoreErrorJson() throws Exception {
        when(researchJobMapper.markFailed(eq("job-8"), anyString(), any(LocalDateTime.class))).thenReturn(1);

        service.markFailed("job-8", "boom");

        ArgumentCaptor<String> errors = ArgumentCaptor.forClass(String.class);
        verify(researchJobMapper).markFailed(eq("job-8"), errors.capture(), any(LocalDateTime.class));
        assertEquals("boom", objectMapper.readTree(errors.getValue()).get("error").asText());
        assertNotNull(objectMapper.readTree(errors.getValue()).get("timestamp"));
    }

    @Test
    void markCompleted_shouldIgnoreTerminalJob() {
        when(researchJobMapper.markCompleted(eq("job-9"), anyString(), any(LocalDateTime.class))).thenReturn(0);

        service.markCompleted("job-9", new ResearchResult());

        verify(researchJobMapper, never()).updateById(any(ResearchJob.class));
    }

    @Test
    void recordProgress_shouldDelegateToConditionalUpdate() {
        service.recordProgress("job-10", "researching_weather", 2);

        verify(researchJobMapper).updateProgress("job-10", "researching_weather", 2);
    }

    @Test
    void deleteJob_shouldThrowNotFound_whenMissing() {
        when(researchJobMapper.selectById("gone")).thenReturn(null);

        assertThrows(BaseException.class, () -> service.deleteJob("gone"));
        verify(researchJobMapper, never()).deleteById(anyString());
    }

    private static ResearchJob job(String id, String status) {
        ResearchJob job = new ResearchJob();
        job.setId(id);
        job.setStatus(status);
        job.setTotalSteps(0);
        job.setCompletedSteps(0);
        job.setCreateTime(LocalDateTime.now());
        return job;
    }
}
