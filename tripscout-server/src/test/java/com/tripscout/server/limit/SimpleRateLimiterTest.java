package com.tripscout.server.limit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SimpleRateLimiterTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @InjectMocks
    private SimpleRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void tryAcquire_shouldSetExpiryOnFirstHit() {
        when(valueOperations.increment("tripscout:rl:research:start:u-1")).thenReturn(1L);

        assertTrue(rateLimiter.tryAcquire("research:start", "u-1", 60, 10));
        verify(stringRedisTemplate).expire("tripscout:rl:research:start:u-1", 60, TimeUnit.SECONDS);
    }

    @Test
    void tryAcquire_shouldReject_whenOverLimit() {
        when(valueOperations.increment("tripscout:rl:research:start:u-1")).thenReturn(11L);

        assertFalse(rateLimiter.tryAcquire("research:start", "u-1", 60, 10));
        verify(stringRedisTemplate, never()).expire(anyString(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void tryAcquire_shouldAllow_whenRedisUnavailable() {
        when(valueOperations.increment(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(rateLimiter.tryAcquire("research:start", null, 60, 10));
    }
}
