package com.tripscout.server.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripscout.common.constant.RedisConstants;
import com.tripscout.pojo.research.category.WeatherInfo;
import com.tripscout.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CacheClient 的基础单元测试：
 * - 命中时不回源；
 * - 未命中时回源并回写，回源结果为空时不写缓存；
 * - Redis 不可用时退化为直接回源；
 * - key 拼接与类别解析。
 *
 * 使用 Mockito 模拟 Redis，不依赖真实实例。
 */
@ExtendWith(MockitoExtension.class)
class CacheClientTest {

    private static final TypeReference<WeatherInfo> WEATHER = new TypeReference<>() {
    };

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private MetricsRecorder metricsRecorder;

    private ObjectMapper objectMapper;
    private CacheClient cacheClient;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        cacheClient = new CacheClient(stringRedisTemplate, objectMapper, metricsRecorder);
    }

    @Test
    void queryWithPassThrough_shouldReturnCachedValue_whenCacheHit() throws Exception {
        String key = RedisConstants.CACHE_WEATHER_KEY + "bali";
        WeatherInfo cached = WeatherInfo.builder().temperature(28.0).condition("Clear").build();
        when(valueOperations.get(key)).thenReturn(objectMapper.writeValueAsString(cached));

        WeatherInfo result = cacheClient.queryWithPassThrough(key, WEATHER, () -> {
            throw new IllegalStateException("loader should not be called when cache hit");
        }, 60, TimeUnit.MINUTES);

        assertEquals(cached, result);
        verify(metricsRecorder).recordCacheHit("weather", true);
        verify(valueOperations, never()).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void queryWithPassThrough_shouldLoadAndCache_whenCacheMiss() {
        String key = RedisConstants.CACHE_WEATHER_KEY + "tokyo";
        when(valueOperations.get(key)).thenReturn(null);
        WeatherInfo fresh = WeatherInfo.builder().temperature(18.0).condition("Rain").build();

        WeatherInfo result = cacheClient.queryWithPassThrough(key, WEATHER, () -> fresh, 60, TimeUnit.MINUTES);

        assertEquals(fresh, result);
        verify(metricsRecorder).recordCacheHit("weather", false);
        verify(valueOperations).set(eq(key), anyString(), eq(60L), eq(TimeUnit.MINUTES));
    }

    @Test
    void queryWithPassThrough_shouldNotCache_whenLoaderReturnsNull() {
        String key = RedisConstants.CACHE_VISA_KEY + "us:xx";
        when(valueOperations.get(key)).thenReturn(null);

        Object result = cacheClient.queryWithPassThrough(key, new TypeReference<Object>() {
        }, () -> null, 24, TimeUnit.HOURS);

        assertNull(result);
        verify(valueOperations, never()).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void queryWithPassThrough_shouldFallBackToLoader_whenRedisDown() {
        String key = RedisConstants.CACHE_WEATHER_KEY + "paris";
        when(valueOperations.get(key)).thenThrow(new RedisConnectionFailureException("connection refused"));
        lenient().doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));
        AtomicInteger calls = new AtomicInteger();

        WeatherInfo result = cacheClient.queryWithPassThrough(key, WEATHER, () -> {
            calls.incrementAndGet();
            return WeatherInfo.builder().temperature(15.0).build();
        }, 60, TimeUnit.MINUTES);

        assertEquals(15.0, result.getTemperature());
        assertEquals(1, calls.get());
    }

    @Test
    void queryWithPassThrough_shouldPropagateLoaderException() {
        String key = RedisConstants.CACHE_WEATHER_KEY + "rome";
        when(valueOperations.get(key)).thenReturn(null);

        assertThrows(IllegalStateException.class, () -> cacheClient.queryWithPassThrough(key, WEATHER, () -> {
            throw new IllegalStateException("upstream 500");
        }, 60, TimeUnit.MINUTES));
    }

    @Test
    void get_shouldReturnNull_whenCachedJsonIsCorrupted() {
        when(valueOperations.get("k")).thenReturn("{not json");

        assertNull(cacheClient.get("k", WeatherInfo.class));
    }

    @Test
    void deleteByPrefix_shouldDeleteMatchingKeys() {
        Set<String> keys = Set.of("tripscout:cache:weather:a", "tripscout:cache:weather:b");
        when(stringRedisTemplate.keys("tripscout:cache:weather:*")).thenReturn(keys);
        when(stringRedisTemplate.delete(keys)).thenReturn(2L);

        assertEquals(2, cacheClient.deleteByPrefix(RedisConstants.CACHE_WEATHER_KEY));
    }

    @Test
    void buildKey_shouldNormalizeParts() {
        String key = CacheClient.buildKey(RedisConstants.CACHE_HOTELS_KEY, "Bali, Indonesia", null, 2);

        assertEquals("tripscout:cache:hotels:bali,_indonesia:_:2", key);
    }

    @Test
    void categoryOf_shouldExtractCategoryFromKey() {
        List.of("weather", "visa", "attractions").forEach(c ->
                assertEquals(c, CacheClient.categoryOf(RedisConstants.CACHE_PREFIX + c + ":x")));
        assertEquals("unknown", CacheClient.categoryOf("other:key"));
    }
}
