package com.pinclick.copilot.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local fallback. Holds serialized snapshots, never live objects, so a turn that fails
 * after mutating its state cannot leak the mutation into the store.
 */
@Component
public class InMemoryContextBackend implements ContextBackend {

    private record Entry(String value, Instant expiresAt) {
    }

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryContextBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> getAndTouch(String key, Duration ttl) {
        Instant now = clock.instant();
        Entry touched = entries.computeIfPresent(key, (k, e) ->
                e.expiresAt().isAfter(now) ? new Entry(e.value(), now.plus(ttl)) : null);
        return touched == null ? Optional.empty() : Optional.of(touched.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        entries.values().removeIf(e -> !e.expiresAt().isAfter(now));
        entries.put(key, new Entry(value, now.plus(ttl)));
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public boolean ping() {
        return true;
    }

    public int size() {
        Instant now = clock.instant();
        return (int) entries.values().stream().filter(e -> e.expiresAt().isAfter(now)).count();
    }
}
