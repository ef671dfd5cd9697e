package com.tripscout.server.research.progress;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.JobStatus;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.research.ResultsSummary;
import com.tripscout.server.ws.ResearchEventPublisher;
import lombok.RequiredArgsConstructor;

/**
 * 把调研进度推送给订阅该任务的连接，任务结束时再通知提交者的用户频道。
 */
@RequiredArgsConstructor
public class EventChannelProgressSink implements ProgressSink {

    private final ResearchEventPublisher researchEventPublisher;

    /** 可为空 */
    private final String userId;

    @Override
    public void onStarted(String jobId, TravelPreferencesDTO preferences, int totalSteps) {
        researchEventPublisher.researchStarted(jobId, preferences);
    }

    @Override
    public void onProgress(ResearchProgress progress) {
        researchEventPublisher.researchProgress(progress);
    }

    @Override
    public void onCompleted(String jobId, ResearchResult result) {
        researchEventPublisher.researchCompleted(jobId, ResultsSummary.of(result));
        researchEventPublisher.jobFinished(userId, jobId, JobStatus.COMPLETED.getValue());
    }

    @Override
    public void onFailed(String jobId, String error) {
        researchEventPublisher.researchError(jobId, error);
        researchEventPublisher.jobFinished(userId, jobId, JobStatus.FAILED.getValue());
    }
}
