package com.pinclick.copilot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisContextBackendTest {

    private static final Duration TTL = Duration.ofMinutes(90);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisContextBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RedisContextBackend(redisTemplate);
    }

    @Test
    void readRefreshesExpiryInOneCommand() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.getAndExpire("call:s-1", TTL)).thenReturn("{\"session_id\":\"s-1\"}");
        when(valueOperations.getAndExpire("call:missing", TTL)).thenReturn(null);

        assertThat(backend.getAndTouch("call:s-1", TTL)).contains("{\"session_id\":\"s-1\"}");
        assertThat(backend.getAndTouch("call:missing", TTL)).isEmpty();
    }

    @Test
    void writeSetsValueWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        backend.put("call:s-1", "{}", TTL);
        backend.remove("call:s-1");

        verify(valueOperations).set("call:s-1", "{}", TTL);
        verify(redisTemplate).delete("call:s-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingExpectsPong() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG").thenReturn(null);

        assertThat(backend.ping()).isTrue();
        assertThat(backend.ping()).isFalse();
    }
}
