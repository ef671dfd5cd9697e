package com.tripscout.server.ws;

import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.research.ResearchProgress;
import com.tripscout.pojo.research.ResultsSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 调研任务事件的消息格式，统一由这里组装后交给 {@link ConnectionRegistry} 推送。
 */
@Component
@RequiredArgsConstructor
public class ResearchEventPublisher {

    private final ConnectionRegistry connectionRegistry;

    public void researchStarted(String jobId, TravelPreferencesDTO preferences) {
        Map<String, Object> event = event("started", jobId);
        event.put("preferences", preferences);
        event.put("message", "Research started");
        connectionRegistry.publish(SubscriptionScope.JOB, jobId, event);
    }

    public void researchProgress(ResearchProgress progress) {
        Map<String, Object> event = event("progress", progress.getJobId());
        event.put("step", progress.getStep());
        event.put("percentage", progress.getPercentage());
        event.put("message", progress.getMessage());
        event.put("completed_steps", progress.getCompletedSteps());
        event.put("total_steps", progress.getTotalSteps());
        connectionRegistry.publish(SubscriptionScope.JOB, progress.getJobId(), event);
    }

    public void researchCompleted(String jobId, ResultsSummary summary) {
        Map<String, Object> event = event("completed", jobId);
        event.put("message", "Research completed!");
        event.put("results_summary", summary);
        connectionRegistry.publish(SubscriptionScope.JOB, jobId, event);
    }

    public void researchError(String jobId, String error) {
        Map<String, Object> event = event("error", jobId);
        event.put("error", error);
        connectionRegistry.publish(SubscriptionScope.JOB, jobId, event);
    }

    /**
     * 用户频道只收到任务结束通知，不收逐步进度。
     */
    public void jobFinished(String userId, String jobId, String status) {
        if (userId == null) {
            return;
        }
        Map<String, Object> event = event("job_finished", jobId);
        event.put("status", status);
        connectionRegistry.publish(SubscriptionScope.USER, userId, event);
    }

    /**
     * @return 成功送达的连接数
     */
    public int announce(String message) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "announcement");
        event.put("message", message);
        return connectionRegistry.broadcast(event);
    }

    private Map<String, Object> event(String type, String jobId) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        event.put("job_id", jobId);
        return event;
    }
}
