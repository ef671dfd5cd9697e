package com.tripscout.server.research.progress;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * 依次通知多个 sink，单个 sink 出错只记日志，不影响其它 sink 和调研本身。
 */
@Slf4j
public class CompositeProgressSink implements ProgressSink {

    private final List<ProgressSink> sinks;

    public CompositeProgressSink(List<ProgressSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static CompositeProgressSink of(ProgressSink... sinks) {
        return new CompositeProgressSink(List.of(sinks));
    }

    @Override
    public void onStarted(String jobId, TravelPreferencesDTO preferences, int totalSteps) {
        each(jobId, "started", s -> s.onStarted(jobId, preferences, totalSteps));
    }

    @Override
    public void onProgress(ResearchProgress progress) {
        each(progress.getJobId(), "progress", s -> s.onProgress(progress));
    }

    @Override
    public void onCompleted(String jobId, ResearchResult result) {
        each(jobId, "completed", s -> s.onCompleted(jobId, result));
    }

    @Override
    public void onFailed(String jobId, String error) {
        each(jobId, "failed", s -> s.onFailed(jobId, error));
    }

    private void each(String jobId, String event, Consumer<ProgressSink> action) {
        for (ProgressSink sink : sinks) {
            try {
                action.accept(sink);
            } catch (Exception e) {
                log.warn("进度通知失败, jobId={}, event={}, sink={}, err={}",
                        jobId, event, sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
