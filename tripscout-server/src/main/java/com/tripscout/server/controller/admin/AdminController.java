package com.tripscout.server.controller.admin;

import com.tripscout.common.constant.RedisConstants;
import com.tripscout.common.result.Result;
import com.tripscout.server.utils.CacheClient;
import com.tripscout.server.ws.ConnectionRegistry;
import com.tripscout.server.ws.ResearchEventPublisher;
import com.tripscout.server.ws.SubscriptionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维接口：清理数据源缓存、查看实时连接、全局公告。
 */
@RestController
@RequestMapping("/api/v1/admin")
@Slf4j
@RequiredArgsConstructor
public class AdminController {

    private final CacheClient cacheClient;
    private final ConnectionRegistry connectionRegistry;
    private final ResearchEventPublisher researchEventPublisher;

    /**
     * 按类别前缀清理缓存，例如 prefix=weather；不传时清理全部数据源缓存。
     */
    @DeleteMapping("/cache")
    public Result<Long> clearCache(@RequestParam(value = "prefix", required = false) String prefix) {
        String fullPrefix = RedisConstants.CACHE_PREFIX + (StringUtils.hasText(prefix) ? prefix.trim() : "");
        long deleted = cacheClient.deleteByPrefix(fullPrefix);
        log.info("清理缓存: prefix={}, deleted={}", fullPrefix, deleted);
        return Result.success(deleted);
    }

    @GetMapping("/connections")
    public Result<Map<String, Object>> connections(@RequestParam(value = "job_id", required = false) String jobId) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("connections", connectionRegistry.connectionCount());
        stats.put("global_subscribers", connectionRegistry.subscriberCount(SubscriptionScope.GLOBAL, null));
        if (StringUtils.hasText(jobId)) {
            stats.put("job_subscribers", connectionRegistry.subscriberCount(SubscriptionScope.JOB, jobId));
        }
        return Result.success(stats);
    }

    @PostMapping("/announcements")
    public Result<Integer> announce(@RequestParam String message) {
        int delivered = researchEventPublisher.announce(message);
        log.info("发送全局公告: delivered={}", delivered);
        return Result.success(delivered);
    }
}
