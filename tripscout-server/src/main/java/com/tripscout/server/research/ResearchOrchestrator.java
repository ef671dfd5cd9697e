package com.tripscout.server.research;

import com.tripscout.common.exception.ResearchException;
import com.tripscout.common.properties.ResearchProperties;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.DestinationResearch;
import com.tripscout.pojo.research.DestinationStatus;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.research.ScoreBreakdown;
import com.tripscout.server.research.progress.ProgressSink;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 目的地调研编排器。
 *
 * 状态机：INITIALIZING -> SUGGESTING -> RESEARCHING -> COMPILING -> DONE / ERROR
 * - INITIALIZING：补全兴趣、确定候选目的地与总步数，发出 started；
 * - SUGGESTING：未指定目的地时推荐候选列表（单独计一步）；
 * - RESEARCHING：对前 N 个目的地依次调研并打分，单个目的地失败不影响其它目的地；
 * - COMPILING：生成对比表与推荐，发出 completed。
 *
 * 外部只需调用 {@link #run(String, TravelPreferencesDTO, ProgressSink)}。
 * 任务级失败时先通知 sink（failed 步骤 + 失败事件），再抛出 {@link ResearchException}。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchOrchestrator {

    private final DestinationSuggester destinationSuggester;
    private final DestinationResearcher destinationResearcher;
    private final ScoringEngine scoringEngine;
    private final RecommendationBuilder recommendationBuilder;
    private final ResearchProperties researchProperties;

    public ResearchResult run(String jobId, TravelPreferencesDTO request, ProgressSink sink) {
        ResearchState state = ResearchState.INITIALIZING;
        ResearchRunContext ctx = new ResearchRunContext();
        ctx.setJobId(jobId);

        try {
            while (state != ResearchState.DONE && state != ResearchState.ERROR) {
                switch (state) {
                    case INITIALIZING -> {
                        TravelPreferencesDTO preferences = enrich(request);
                        ctx.setPreferences(preferences);
                        boolean derive = preferences.getDestinations() == null || preferences.getDestinations().isEmpty();
                        ctx.setShortlistDerived(derive);
                        List<String> candidates = derive
                                ? destinationSuggester.suggest(preferences)
                                : preferences.getDestinations();
                        ctx.setCandidates(candidates);
                        ctx.setTargets(candidates.stream().limit(researchProperties.getMaxDestinations()).toList());

                        int total = totalSteps(preferences, derive, ctx.getTargets().size());
                        ctx.setTracker(new StepTracker(jobId, total, sink));
                        sink.onStarted(jobId, preferences, total);
                        log.info("调研开始, jobId={}, destinations={}, totalSteps={}", jobId, ctx.getTargets(), total);
                        ctx.getTracker().advance(ResearchStep.INITIALIZING, "Starting research...");
                        state = derive ? ResearchState.SUGGESTING : ResearchState.RESEARCHING;
                    }
                    case SUGGESTING -> {
                        ctx.getTracker().advance(ResearchStep.ANALYZING_PREFERENCES,
                                "Finding best destinations for your preferences...");
                        state = ResearchState.RESEARCHING;
                    }
                    case RESEARCHING -> {
                        for (String destination : ctx.getTargets()) {
                            ctx.getDestinations().add(researchOne(destination, ctx));
                        }
                        state = ResearchState.COMPILING;
                    }
                    case COMPILING -> {
                        ctx.getTracker().advance(ResearchStep.COMPILING_RESULTS, "Compiling final recommendations...");
                        ResearchResult result = compile(ctx);
                        ctx.setResult(result);
                        sink.onCompleted(jobId, result);
                        log.info("调研完成, jobId={}, ranked={}", jobId, result.getRecommendations().size());
                        state = ResearchState.DONE;
                    }
                    default -> state = ResearchState.ERROR;
                }
            }
        } catch (Exception e) {
            log.error("调研任务失败, jobId={}, state={}", jobId, state, e);
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (ctx.getTracker() != null) {
                ctx.getTracker().fail("Research failed: " + error);
            }
            sink.onFailed(jobId, error);
            throw new ResearchException(error, e);
        }
        return ctx.getResult();
    }

    /**
     * 总步数：初始化 1 + 推荐 1（仅自动推荐时）+ 每个目的地的步数 + 汇总 1。
     */
    int totalSteps(TravelPreferencesDTO preferences, boolean shortlistDerived, int destinations) {
        return 1 + (shortlistDerived ? 1 : 0)
                + destinations * destinationResearcher.stepsFor(preferences)
                + 1;
    }

    /**
     * 组团出行补充 nightlife，情侣浪漫出行补充 relaxation；不修改调用方传入的对象。
     */
    static TravelPreferencesDTO enrich(TravelPreferencesDTO request) {
        TravelPreferencesDTO preferences = request.copy();
        String with = preferences.getTravelingWith() == null ? "" : preferences.getTravelingWith().toLowerCase(Locale.ROOT);
        if ("group".equals(with) && !preferences.hasInterest("nightlife")) {
            preferences.getInterests().add("nightlife");
        }
        if ("couple".equals(with) && "romantic".equalsIgnoreCase(preferences.getTripType())
                && !preferences.hasInterest("relaxation")) {
            preferences.getInterests().add("relaxation");
        }
        return preferences;
    }

    private DestinationResearch researchOne(String destination, ResearchRunContext ctx) {
        try {
            DestinationResearch dr = destinationResearcher.research(destination, ctx.getPreferences(), ctx.getTracker());
            ScoreBreakdown scores = scoringEngine.score(dr, ctx.getPreferences());
            dr.setScores(scores);
            dr.setOverallScore(scores.getOverall());
            return dr;
        } catch (Exception e) {
            log.warn("目的地调研失败, jobId={}, destination={}", ctx.getJobId(), destination, e);
            DestinationResearch failed = new DestinationResearch(destination);
            failed.setStatus(DestinationStatus.FAILED);
            failed.setCategories(null);
            failed.setError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return failed;
        }
    }

    private ResearchResult compile(ResearchRunContext ctx) {
        ResearchResult result = new ResearchResult();
        result.setPreferences(ctx.getPreferences());
        result.setResearchTimestamp(LocalDateTime.now());
        if (ctx.isShortlistDerived()) {
            result.setSuggestedDestinations(ctx.getCandidates());
        }
        result.setDestinations(ctx.getDestinations());
        result.setComparison(recommendationBuilder.comparison(ctx.getDestinations(), ctx.getPreferences()));
        result.setRecommendations(recommendationBuilder.recommendations(ctx.getDestinations(), ctx.getPreferences()));
        return result;
    }

    private enum ResearchState {
        INITIALIZING,
        SUGGESTING,
        RESEARCHING,
        COMPILING,
        DONE,
        ERROR
    }

    /**
     * 单次编排的上下文。
     */
    @Data
    private static class ResearchRunContext {
        private String jobId;
        private TravelPreferencesDTO preferences;
        private boolean shortlistDerived;
        private List<String> candidates;
        private List<String> targets;
        private StepTracker tracker;
        private List<DestinationResearch> destinations = new ArrayList<>();
        private ResearchResult result;
    }
}
