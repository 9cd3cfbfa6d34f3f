package com.pinclick.copilot.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value storage for serialized session envelopes with a sliding TTL.
 */
public interface ContextBackend {

    /**
     * Reads a value and refreshes its TTL in the same step. Empty when absent or expired.
     */
    Optional<String> getAndTouch(String key, Duration ttl);

    void put(String key, String value, Duration ttl);

    void remove(String key);

    boolean ping();
}
