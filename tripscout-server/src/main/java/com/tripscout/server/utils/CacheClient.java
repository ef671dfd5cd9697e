package com.tripscout.server.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 数据源缓存客户端。
 *
 * 约定：
 * - 缓存只是延迟优化，Redis 不可用时所有操作退化为未命中 / 空操作，只记日志不抛异常；
 * - 值统一用 JSON 字符串存储，TTL 交给 Redis 原生过期。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheClient {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    public void set(String key, Object value, long time, TimeUnit unit) {
        if (value == null) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            stringRedisTemplate.opsForValue().set(key, json, time, unit);
        } catch (Exception e) {
            log.warn("写入缓存失败, key={}, err={}", key, e.getMessage());
        }
    }

    public <R> R get(String key, Class<R> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    public <R> R get(String key, TypeReference<R> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    private <R> R get(String key, JavaType type) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            log.warn("读取缓存失败, key={}, err={}", key, e.getMessage());
            return null;
        }
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("反序列化缓存失败, key={}", key, e);
            return null;
        }
    }

    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(stringRedisTemplate.delete(key));
        } catch (Exception e) {
            log.warn("删除缓存失败, key={}, err={}", key, e.getMessage());
            return false;
        }
    }

    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(stringRedisTemplate.hasKey(key));
        } catch (Exception e) {
            log.warn("查询缓存是否存在失败, key={}, err={}", key, e.getMessage());
            return false;
        }
    }

    /**
     * 按前缀批量删除，仅用于管理接口，返回删除的 key 数量。
     */
    public long deleteByPrefix(String prefix) {
        try {
            Set<String> keys = stringRedisTemplate.keys(prefix + "*");
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = stringRedisTemplate.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (Exception e) {
            log.warn("按前缀清理缓存失败, prefix={}, err={}", prefix, e.getMessage());
            return 0;
        }
    }

    /**
     * 读穿缓存：命中直接返回；未命中调用 loader 并回写。
     * loader 返回 null 时不写缓存，loader 抛出的异常原样向上传递。
     */
    public <R> R queryWithPassThrough(String key, TypeReference<R> type,
                                      Supplier<R> loader, long time, TimeUnit unit) {
        String category = categoryOf(key);
        R cached = get(key, type);
        if (cached != null) {
            metricsRecorder.recordCacheHit(category, true);
            return cached;
        }
        metricsRecorder.recordCacheHit(category, false);
        R fresh = loader.get();
        if (fresh != null) {
            set(key, fresh, time, unit);
        }
        return fresh;
    }

    /**
     * 拼接缓存 key：前缀 + 各参数（小写、空格转下划线、null 记为 _），用冒号分隔。
     */
    public static String buildKey(String prefix, Object... parts) {
        StringJoiner joiner = new StringJoiner(":");
        for (Object part : parts) {
            if (part == null) {
                joiner.add("_");
            } else {
                joiner.add(part.toString().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_"));
            }
        }
        return prefix + joiner;
    }

    static String categoryOf(String key) {
        if (key == null || !key.startsWith(RedisConstants.CACHE_PREFIX)) {
            return "unknown";
        }
        String rest = key.substring(RedisConstants.CACHE_PREFIX.length());
        int idx = rest.indexOf(':');
        return idx > 0 ? rest.substring(0, idx) : rest;
    }
}
