package com.pinclick.copilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.pinclick.copilot.dto.StoreHealthResponse;
import com.pinclick.copilot.model.ContextEnvelope;
import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.StoreMode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Session Context Store. Keeps one {@link ContextEnvelope} per session id under a sliding TTL,
 * in Redis while it is reachable and in process memory otherwise.
 *
 * <p>The in-memory mode is a degraded mode: state does not survive a restart and is not
 * visible to other instances. The switch is logged and reported by {@link #health()}.
 */
@Service
public class SessionContextService {

    private static final Logger log = LoggerFactory.getLogger(SessionContextService.class);

    private final RedisContextBackend durable;
    private final InMemoryContextBackend memory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final String keyPrefix;
    private final boolean durableEnabled;
    private final AtomicReference<StoreMode> mode = new AtomicReference<>(StoreMode.DURABLE);
    // One lock per session id, collected once no turn holds a reference to it.
    private final LoadingCache<String, Lock> sessionLocks = CacheBuilder.newBuilder()
            .weakValues()
            .build(new CacheLoader<String, Lock>() {
                @Override
                public Lock load(String sessionId) {
                    return new ReentrantLock();
                }
            });

    public SessionContextService(RedisContextBackend durable,
                                 InMemoryContextBackend memory,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 @Value("${copilot.session.ttl-seconds:5400}") long ttlSeconds,
                                 @Value("${copilot.session.key-prefix:call:}") String keyPrefix,
                                 @Value("${copilot.session.durable-enabled:true}") boolean durableEnabled) {
        this.durable = durable;
        this.memory = memory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.keyPrefix = keyPrefix;
        this.durableEnabled = durableEnabled;
        if (!durableEnabled) {
            mode.set(StoreMode.IN_MEMORY);
        }
    }

    @PostConstruct
    void probeOnStartup() {
        if (!durableEnabled) {
            log.warn("Durable session store disabled by configuration; sessions are process-local");
            return;
        }
        if (probeDurable()) {
            log.info("Session store using Redis (ttl {}s, prefix '{}')", ttl.getSeconds(), keyPrefix);
        } else {
            degrade(null);
        }
    }

    public Optional<ConversationState> get(String sessionId) {
        String key = key(sessionId);
        Optional<String> json = withBackend("read", backend -> backend.getAndTouch(key, ttl));
        return json.flatMap(value -> readEnvelope(sessionId, value)).map(ContextEnvelope::state);
    }

    public void set(String sessionId, ConversationState state) {
        String key = key(sessionId);
        String json = writeEnvelope(new ContextEnvelope(sessionId, state, clock.instant()));
        withBackend("write", backend -> {
            backend.put(key, json, ttl);
            return null;
        });
    }

    public void delete(String sessionId) {
        String key = key(sessionId);
        withBackend("delete", backend -> {
            backend.remove(key);
            return null;
        });
        memory.remove(key);
    }

    public StoreMode mode() {
        return mode.get();
    }

    /**
     * Lock serializing turns of one session. Distinct sessions never share a lock.
     */
    public Lock lockFor(String sessionId) {
        return sessionLocks.getUnchecked(sessionId);
    }

    /**
     * Re-probes Redis and returns to the durable mode when it answers again.
     */
    public StoreHealthResponse health() {
        boolean reachable = durableEnabled && probeDurable();
        if (reachable && mode.compareAndSet(StoreMode.IN_MEMORY, StoreMode.DURABLE)) {
            log.info("Redis reachable again; session store back in DURABLE mode. "
                    + "{} in-memory session(s) are not migrated", memory.size());
        }
        StoreMode current = mode.get();
        return new StoreHealthResponse(current == StoreMode.DURABLE ? "healthy" : "degraded",
                current, reachable, memory.size());
    }

    private <T> T withBackend(String operation, Function<ContextBackend, T> action) {
        if (mode.get() == StoreMode.DURABLE) {
            try {
                return action.apply(durable);
            } catch (RuntimeException e) {
                log.warn("Session store {} failed on Redis: {}", operation, e.getMessage());
                degrade(e);
            }
        }
        return action.apply(memory);
    }

    private void degrade(RuntimeException cause) {
        if (mode.getAndSet(StoreMode.IN_MEMORY) != StoreMode.IN_MEMORY) {
            log.warn("Session store degraded to IN_MEMORY mode: state is process-local and will not "
                    + "survive a restart{}", cause == null ? "" : " (" + cause.getClass().getSimpleName() + ")");
        }
    }

    private boolean probeDurable() {
        try {
            return durable.ping();
        } catch (RuntimeException e) {
            log.debug("Redis probe failed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<ContextEnvelope> readEnvelope(String sessionId, String json) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, ContextEnvelope.class));
        } catch (JsonProcessingException e) {
            log.warn("Session {}: stored context is unreadable and will be replaced: {}", sessionId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String writeEnvelope(ContextEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize context for session " + envelope.sessionId(), e);
        }
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }
}
