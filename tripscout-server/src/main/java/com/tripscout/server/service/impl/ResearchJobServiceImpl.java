package com.tripscout.server.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.common.exception.BaseException;
import com.tripscout.common.result.ErrorCode;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.JobStatus;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.vo.ResearchJobVO;
import com.tripscout.server.mapper.ResearchJobMapper;
import com.tripscout.server.service.ResearchJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 调研任务服务实现。
 *
 * 约定：
 * - 状态只会 pending -> in_progress -> completed | failed 单向流转，终态行不再被更新；
 * - 进度更新带 completed_steps 条件，乱序到达的旧进度不会覆盖新进度；
 * - 结果和错误以 JSON 文本存储。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchJobServiceImpl extends ServiceImpl<ResearchJobMapper, ResearchJob> implements ResearchJobService {

    public static final String JOB_TYPE = "destination_research";

    private final ObjectMapper objectMapper;

    @Override
    public ResearchJob createJob(String userId, TravelPreferencesDTO preferences) {
        ResearchJob job = new ResearchJob();
        job.setId(UUID.randomUUID().toString());
        job.setUserId(userId);
        job.setJobType(JOB_TYPE);
        job.setStatus(JobStatus.PENDING.getValue());
        job.setQueryParams(toJson(preferences));
        job.setTotalSteps(0);
        job.setCompletedSteps(0);
        job.setCurrentStep("initializing");
        job.setCreateTime(LocalDateTime.now());
        baseMapper.insert(job);
        log.info("创建调研任务, jobId={}, userId={}", job.getId(), userId);
        return job;
    }

    @Override
    public ResearchJob getJob(String jobId) {
        ResearchJob job = jobId == null ? null : baseMapper.selectById(jobId);
        if (job == null) {
            throw new BaseException(ErrorCode.JOB_NOT_FOUND);
        }
        return job;
    }

    @Override
    public ResearchJobVO getStatus(String jobId) {
        return toVO(getJob(jobId));
    }

    @Override
    public ResearchResult getResults(String jobId) {
        ResearchJob job = getJob(jobId);
        if (!JobStatus.COMPLETED.getValue().equals(job.getStatus())) {
            throw new BaseException(ErrorCode.JOB_NOT_COMPLETED,
                    "调研任务尚未完成，当前状态: " + job.getStatus());
        }
        if (!StringUtils.hasText(job.getResults())) {
            throw new BaseException(ErrorCode.JOB_RESULTS_MISSING);
        }
        try {
            return objectMapper.readValue(job.getResults(), ResearchResult.class);
        } catch (JsonProcessingException e) {
            log.error("调研结果解析失败, jobId={}", jobId, e);
            throw new BaseException(ErrorCode.JOB_RESULTS_CORRUPTED);
        }
    }

    @Override
    public List<ResearchJobVO> listJobs(String userId, String status, int limit) {
        int size = Math.max(1, Math.min(limit, 100));
        LambdaQueryWrapper<ResearchJob> wrapper = new LambdaQueryWrapper<ResearchJob>()
                .eq(StringUtils.hasText(userId), ResearchJob::getUserId, userId)
                .eq(StringUtils.hasText(status), ResearchJob::getStatus, status)
                .orderByDesc(ResearchJob::getCreateTime)
                .last("LIMIT " + size);
        return baseMapper.selectList(wrapper).stream()
                .map(this::toVO)
                .toList();
    }

    @Override
    public void deleteJob(String jobId) {
        getJob(jobId);
        baseMapper.deleteById(jobId);
        log.info("删除调研任务, jobId={}", jobId);
    }

    @Override
    public void markInProgress(String jobId, int totalSteps) {
        int rows = baseMapper.markInProgress(jobId, totalSteps, LocalDateTime.now());
        if (rows == 0) {
            log.warn("任务状态不是 pending，忽略开始事件, jobId={}", jobId);
        }
    }

    @Override
    public void recordProgress(String jobId, String step, int completedSteps) {
        int rows = baseMapper.updateProgress(jobId, step, completedSteps);
        if (rows == 0) {
            log.debug("进度未更新（任务已结束或进度落后）, jobId={}, step={}, completed={}",
                    jobId, step, completedSteps);
        }
    }

    @Override
    public void markCompleted(String jobId, ResearchResult result) {
        int rows = baseMapper.markCompleted(jobId, toJson(result), LocalDateTime.now());
        if (rows == 0) {
            log.warn("任务已处于终态，忽略完成事件, jobId={}", jobId);
        }
    }

    @Override
    public void markFailed(String jobId, String error) {
        Map<String, Object> errors = new LinkedHashMap<>();
        errors.put("error", error);
        errors.put("timestamp", LocalDateTime.now().toString());
        int rows = baseMapper.markFailed(jobId, toJson(errors), LocalDateTime.now());
        if (rows == 0) {
            log.warn("任务已处于终态，忽略失败事件, jobId={}", jobId);
        }
    }

    private ResearchJobVO toVO(ResearchJob job) {
        int completed = job.getCompletedSteps() == null ? 0 : job.getCompletedSteps();
        int total = job.getTotalSteps() == null ? 0 : job.getTotalSteps();
        boolean done = JobStatus.COMPLETED.getValue().equals(job.getStatus());

        ResearchJobVO vo = new ResearchJobVO();
        vo.setJobId(job.getId());
        vo.setStatus(job.getStatus());
        vo.setProgressPercentage(done ? 100 : ResearchProgress.percentageOf(completed, total));
        vo.setCurrentStep(job.getCurrentStep());
        vo.setCompletedSteps(completed);
        vo.setTotalSteps(total);
        vo.setCreatedAt(job.getCreateTime());
        vo.setStartedAt(job.getStartedAt());
        vo.setCompletedAt(job.getCompletedAt());
        vo.setDestinationsCount(requestedDestinations(job));
        vo.setResultsAvailable(done && StringUtils.hasText(job.getResults()));
        vo.setError(errorMessage(job));
        return vo;
    }

    private int requestedDestinations(ResearchJob job) {
        if (!StringUtils.hasText(job.getQueryParams())) {
            return 0;
        }
        try {
            TravelPreferencesDTO preferences = objectMapper.readValue(job.getQueryParams(), TravelPreferencesDTO.class);
            return preferences.getDestinations() == null ? 0 : preferences.getDestinations().size();
        } catch (JsonProcessingException e) {
            log.warn("任务参数解析失败, jobId={}, err={}", job.getId(), e.getMessage());
            return 0;
        }
    }

    private String errorMessage(ResearchJob job) {
        if (!StringUtils.hasText(job.getErrors())) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(job.getErrors());
            return node.hasNonNull("error") ? node.get("error").asText() : job.getErrors();
        } catch (JsonProcessingException e) {
            return job.getErrors();
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化失败: " + e.getOriginalMessage(), e);
        }
    }
}
