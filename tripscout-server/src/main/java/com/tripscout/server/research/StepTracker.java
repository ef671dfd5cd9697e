package com.tripscout.server.research;

import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.server.research.progress.ProgressSink;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个任务的步骤计数器。总步数在开始前确定，每完成一步加一并通知 sink。
 * 只在任务线程内使用。
 */
@Slf4j
public class StepTracker {

    private final String jobId;
    private final int totalSteps;
    private final ProgressSink sink;
    private int completedSteps;

    public StepTracker(String jobId, int totalSteps, ProgressSink sink) {
        this.jobId = jobId;
        this.totalSteps = totalSteps;
        this.sink = sink;
    }

    public void advance(ResearchStep step, String message) {
        if (completedSteps >= totalSteps) {
            // 计数与预估不一致时不再前进，保证 completed <= total
            log.warn("步骤数超出预估, jobId={}, step={}, total={}", jobId, step.getValue(), totalSteps);
        } else {
            completedSteps++;
        }
        sink.onProgress(ResearchProgress.of(jobId, step.getValue(), message, completedSteps, totalSteps));
    }

    /**
     * 任务失败时发出 failed 步骤，不计入完成数。
     */
    public void fail(String message) {
        sink.onProgress(ResearchProgress.of(jobId, ResearchStep.FAILED.getValue(), message, completedSteps, totalSteps));
    }

    public int getCompletedSteps() {
        return completedSteps;
    }

    public int getTotalSteps() {
        return totalSteps;
    }
}
