package com.pinclick.copilot.service;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable backend. GETEX and SET EX keep read-with-refresh and write-with-TTL atomic per key.
 * Connection failures surface as Spring {@code DataAccessException}s.
 */
@Component
public class RedisContextBackend implements ContextBackend {

    private final StringRedisTemplate redis;

    public RedisContextBackend(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> getAndTouch(String key, Duration ttl) {
        return Optional.ofNullable(redis.opsForValue().getAndExpire(key, ttl));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public void remove(String key) {
        redis.delete(key);
    }

    @Override
    public boolean ping() {
        String reply = redis.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(reply);
    }
}
