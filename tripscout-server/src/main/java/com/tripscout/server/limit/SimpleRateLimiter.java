package com.tripscout.server.limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口计数限流器，用于保护发起调研这类重接口。
 *
 * 说明：
 * - 调用方决定限流维度（userId 或 IP），传入唯一标识；
 * - Redis 不可用时放行，限流不应成为调研功能的强依赖。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimpleRateLimiter {

    private static final String PREFIX = "tripscout:rl:";

    private final StringRedisTemplate stringRedisTemplate;

    /**
     * @param bizKey       业务前缀，例如 research:start
     * @param identify     限流维度标识，如 userId、IP
     * @param windowSecond 时间窗口（秒）
     * @param maxCount     窗口内允许的最大次数
     * @return true 表示允许本次请求
     */
    public boolean tryAcquire(String bizKey, String identify, long windowSecond, long maxCount) {
        if (identify == null) {
            identify = "unknown";
        }
        String key = PREFIX + bizKey + ":" + identify;
        Long count;
        try {
            count = stringRedisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                stringRedisTemplate.expire(key, windowSecond, TimeUnit.SECONDS);
            }
        } catch (Exception e) {
            log.warn("限流计数失败，默认放行: bizKey={}, identify={}, err={}", bizKey, identify, e.getMessage());
            return true;
        }
        if (count == null) {
            return true;
        }
        boolean allowed = count <= maxCount;
        if (!allowed) {
            log.warn("限流触发: bizKey={}, identify={}, windowSecond={}, maxCount={}, current={}",
                    bizKey, identify, windowSecond, maxCount, count);
        }
        return allowed;
    }
}
