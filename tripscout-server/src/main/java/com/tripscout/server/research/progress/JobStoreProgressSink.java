package com.tripscout.server.research.progress;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.server.service.ResearchJobService;
import lombok.RequiredArgsConstructor;

/**
 * 把调研进度写入 research_job 表。
 */
@RequiredArgsConstructor
public class JobStoreProgressSink implements ProgressSink {

    private final ResearchJobService researchJobService;

    @Override
    public void onStarted(String jobId, TravelPreferencesDTO preferences, int totalSteps) {
        researchJobService.markInProgress(jobId, totalSteps);
    }

    @Override
    public void onProgress(ResearchProgress progress) {
        researchJobService.recordProgress(progress.getJobId(), progress.getStep(), progress.getCompletedSteps());
    }

    @Override
    public void onCompleted(String jobId, ResearchResult result) {
        researchJobService.markCompleted(jobId, result);
    }

    @Override
    public void onFailed(String jobId, String error) {
        researchJobService.markFailed(jobId, error);
    }
}
