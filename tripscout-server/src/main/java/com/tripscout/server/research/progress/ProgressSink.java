package com.tripscout.server.research.progress;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResearchResult;

/**
 * 编排器的进度出口：任务表更新与实时推送各自实现一份。
 */
public interface ProgressSink {

    /** 同步快速调研不落库也不推送 */
    ProgressSink NOOP = new ProgressSink() {
    };

    default void onStarted(String jobId, TravelPreferencesDTO preferences, int totalSteps) {
    }

    default void onProgress(ResearchProgress progress) {
    }

    default void onCompleted(String jobId, ResearchResult result) {
    }

    default void onFailed(String jobId, String error) {
    }
}
