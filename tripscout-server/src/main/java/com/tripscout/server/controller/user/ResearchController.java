package com.tripscout.server.controller.user;

import com.tripscout.common.constant.RedisConstants;
import com.tripscout.common.exception.BaseException;
import com.tripscout.common.result.ErrorCode;
import com.tripscout.common.result.Result;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.vo.ResearchJobVO;
import com.tripscout.pojo.vo.ResearchOptionsVO;
import com.tripscout.server.limit.SimpleRateLimiter;
import com.tripscout.server.research.ResearchJobRunner;
import com.tripscout.server.service.ResearchJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 目的地自动调研接口。
 *
 * - POST /start：提交调研任务，立即返回 job_id，进度通过 /ws/research/{jobId} 推送；
 * - GET /status、/results、/jobs：查询任务；
 * - POST /quick-research：单目的地同步调研；
 * - GET /config：表单可选项。
 */
@RestController
@RequestMapping("/api/v1/auto-research")
@Slf4j
@RequiredArgsConstructor
public class ResearchController {

    private static final Set<String> BUDGET_LEVELS = Set.of("low", "moderate", "high", "luxury");
    private static final Set<String> TRAVEL_STYLES = Set.of("solo", "couple", "family", "group");
    private static final Set<String> PACE_PREFERENCES = Set.of("relaxed", "moderate", "busy");

    private final ResearchJobService researchJobService;
    private final ResearchJobRunner researchJobRunner;
    private final SimpleRateLimiter simpleRateLimiter;

    /**
     * 提交调研任务。
     */
    @PostMapping("/start")
    public Result<ResearchJobVO> start(@RequestBody TravelPreferencesDTO preferences,
                                       @RequestParam(value = "user_id", required = false) String userId,
                                       HttpServletRequest request) {
        validate(preferences);
        String identify = StringUtils.hasText(userId) ? userId : request.getRemoteAddr();
        boolean allowed = simpleRateLimiter.tryAcquire(RedisConstants.LIMIT_RESEARCH_START, identify,
                RedisConstants.LIMIT_RESEARCH_WINDOW_SECONDS, RedisConstants.LIMIT_RESEARCH_MAX_COUNT);
        if (!allowed) {
            throw new BaseException(ErrorCode.RATE_LIMITED);
        }

        ResearchJob job = researchJobService.createJob(userId, preferences);
        researchJobRunner.submit(job, preferences);
        log.info("调研任务已提交: jobId={}, userId={}, destinations={}, interests={}",
                job.getId(), userId, preferences.getDestinations(), preferences.getInterests());

        ResearchJobVO vo = new ResearchJobVO();
        vo.setJobId(job.getId());
        vo.setStatus(job.getStatus());
        vo.setProgressPercentage(0);
        vo.setCurrentStep(job.getCurrentStep());
        vo.setCreatedAt(job.getCreateTime());
        vo.setDestinationsCount(preferences.getDestinations() == null ? 0 : preferences.getDestinations().size());
        vo.setResultsAvailable(false);
        return Result.success(vo);
    }

    @GetMapping("/status/{jobId}")
    public Result<ResearchJobVO> status(@PathVariable String jobId) {
        return Result.success(researchJobService.getStatus(jobId));
    }

    @GetMapping("/results/{jobId}")
    public Result<ResearchResult> results(@PathVariable String jobId) {
        return Result.success(researchJobService.getResults(jobId));
    }

    /**
     * 任务列表，按创建时间倒序。
     */
    @GetMapping("/jobs")
    public Result<List<ResearchJobVO>> jobs(@RequestParam(value = "user_id", required = false) String userId,
                                            @RequestParam(value = "status", required = false) String status,
                                            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return Result.success(researchJobService.listJobs(userId, status, limit));
    }

    @DeleteMapping("/jobs/{jobId}")
    public Result<Void> deleteJob(@PathVariable String jobId) {
        researchJobService.deleteJob(jobId);
        return Result.success(null);
    }

    /**
     * 单目的地同步调研，超时请改用 /start。
     */
    @PostMapping("/quick-research")
    public Result<DestinationResearch> quickResearch(@RequestParam String destination,
                                                     @RequestParam(value = "interests", required = false) List<String> interests) {
        if (!StringUtils.hasText(destination)) {
            throw new BaseException(ErrorCode.INVALID_PREFERENCES, "destination 不能为空");
        }
        return Result.success(researchJobRunner.quickResearch(destination.trim(), interests));
    }

    @GetMapping("/config")
    public Result<ResearchOptionsVO> config() {
        ResearchOptionsVO vo = new ResearchOptionsVO();
        vo.setBudgetLevels(List.of("low", "moderate", "high", "luxury"));
        vo.setTravelStyles(List.of("solo", "couple", "family", "group"));
        vo.setVisaPreferences(List.of("visa_free", "visa_on_arrival", "evisa_ok"));
        vo.setWeatherPreferences(List.of("hot", "warm", "mild", "cold", "snow"));
        vo.setInterests(List.of("beach", "mountain", "city", "history", "nature",
                "adventure", "food", "culture", "relaxation", "nightlife",
                "shopping", "art", "music", "sports", "photography",
                "wildlife", "architecture", "wine", "spa", "hiking"));
        vo.setPacePreferences(List.of("relaxed", "moderate", "busy"));
        vo.setMaxFlightDurationOptions(List.of(3, 5, 8, 12, 16, 24));
        return Result.success(vo);
    }

    private void validate(TravelPreferencesDTO preferences) {
        if (preferences == null) {
            throw new BaseException(ErrorCode.INVALID_PREFERENCES, "出行偏好不能为空");
        }
        if (preferences.getTravelStart() != null && preferences.getTravelEnd() != null
                && preferences.getTravelEnd().isBefore(preferences.getTravelStart())) {
            throw new BaseException(ErrorCode.INVALID_PREFERENCES, "travel_end 不能早于 travel_start");
        }
        checkOption("budget_level", preferences.getBudgetLevel(), BUDGET_LEVELS);
        checkOption("traveling_with", preferences.getTravelingWith(), TRAVEL_STYLES);
        checkOption("pace_preference", preferences.getPacePreference(), PACE_PREFERENCES);
        if (preferences.getBudgetAmount() != null && preferences.getBudgetAmount() < 0) {
            throw new BaseException(ErrorCode.INVALID_PREFERENCES, "budget_amount 不能为负数");
        }
    }

    private void checkOption(String field, String value, Set<String> allowed) {
        if (value != null && !allowed.contains(value.toLowerCase(Locale.ROOT))) {
            throw new BaseException(ErrorCode.INVALID_PREFERENCES, field + " 不合法: " + value);
        }
    }
}
