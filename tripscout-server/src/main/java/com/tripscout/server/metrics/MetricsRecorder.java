package com.tripscout.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 未接入 Prometheus 等外部监控时只在本地内存维护统计值，不影响业务逻辑；
 * - 指标命名遵循「组件.业务.动作」，按类别打 tag 便于聚合。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录数据源缓存命中/未命中。
     *
     * @param category 类别，例如 weather / visa
     * @param hit      true 表示命中缓存，false 表示回源
     */
    public void recordCacheHit(String category, boolean hit) {
        try {
            meterRegistry.counter("tripscout.cache",
                    "category", safe(category),
                    "outcome", hit ? "hit" : "miss").increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次数据源调用结果及耗时。
     *
     * @param outcome success / fail / timeout / rejected
     */
    public void recordAdapterCall(String category, String outcome, long latencyMs) {
        try {
            meterRegistry.counter("tripscout.adapter.call",
                    "category", safe(category),
                    "outcome", safe(outcome)).increment();
            meterRegistry.timer("tripscout.adapter.latency",
                    "category", safe(category))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录数据源调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录调研任务最终结果（completed / failed）。
     */
    public void recordJobOutcome(String outcome) {
        try {
            meterRegistry.counter("tripscout.research.job", "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录调研任务指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录实时推送失败次数。
     */
    public void recordEventDeliveryFailure(String scope) {
        try {
            meterRegistry.counter("tripscout.event.delivery_failure", "scope", safe(scope)).increment();
        } catch (Exception e) {
            log.debug("记录推送失败指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
