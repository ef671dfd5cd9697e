package com.tripscout.server.research;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.server.research.progress.ProgressSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 测试用 sink：记录收到的所有回调。
 */
class RecordingProgressSink implements ProgressSink {

    final List<ResearchProgress> progress = new CopyOnWriteArrayList<>();
    volatile Integer startedTotal;
    volatile TravelPreferencesDTO startedPreferences;
    volatile ResearchResult completed;
    volatile String failedError;

    @Override
    public void onStarted(String jobId, TravelPreferencesDTO preferences, int totalSteps) {
        startedTotal = totalSteps;
        startedPreferences = preferences;
    }

    @Override
    public void onProgress(ResearchProgress p) {
        progress.add(p);
    }

    @Override
    public void onCompleted(String jobId, ResearchResult result) {
        completed = result;
    }

    @Override
    public void onFailed(String jobId, String error) {
        failedError = error;
    }

    List<String> steps() {
        return progress.stream().map(ResearchProgress::getStep).toList();
    }

    ResearchProgress last() {
        return progress.get(progress.size() - 1);
    }
}
