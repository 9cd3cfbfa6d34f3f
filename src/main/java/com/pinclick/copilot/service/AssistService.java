package com.pinclick.copilot.service;

import com.pinclick.copilot.dto.StoreHealthResponse;
import com.pinclick.copilot.dto.TurnRequest;
import com.pinclick.copilot.dto.TurnResponse;
import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.TurnOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Turn boundary: per-session serialization, load, run the flow engine, save on success only.
 */
@Service
public class AssistService {

    private static final Logger log = LoggerFactory.getLogger(AssistService.class);

    static final String DEGRADED_MESSAGE =
            "The assistant is temporarily busy. Please try again in a few seconds.";
    static final String FAILURE_MESSAGE =
            "Something went wrong while processing this message. Please try again.";
    static final String BUSY_MESSAGE =
            "A previous message for this conversation is still being processed.";

    private final FlowEngine flowEngine;
    private final SessionContextService sessionContextService;
    private final long lockTimeoutMs;

    public AssistService(FlowEngine flowEngine,
                         SessionContextService sessionContextService,
                         @Value("${copilot.session.lock-timeout-ms:15000}") long lockTimeoutMs) {
        this.flowEngine = flowEngine;
        this.sessionContextService = sessionContextService;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public TurnResponse handle(TurnRequest request) {
        String sessionId = StringUtils.hasText(request.getSessionId())
                ? request.getSessionId().trim()
                : UUID.randomUUID().toString();
        request.setSessionId(sessionId);

        Lock lock = sessionContextService.lockFor(sessionId);
        try {
            if (!lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Session {}: lock not acquired within {} ms", sessionId, lockTimeoutMs);
                return terminal(sessionId, TurnOutcome.SESSION_BUSY, BUSY_MESSAGE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return terminal(sessionId, TurnOutcome.FAILURE, FAILURE_MESSAGE);
        }
        try {
            ConversationState state = sessionContextService.get(sessionId)
                    .orElseGet(() -> new ConversationState(sessionId));
            TurnResponse response = flowEngine.process(state, request);
            sessionContextService.set(sessionId, state);
            response.setStoreMode(sessionContextService.mode());
            return response;
        } catch (ThrottledException te) {
            log.warn("Session {}: language service throttled, turn not applied: {}", sessionId, te.getMessage());
            return terminal(sessionId, TurnOutcome.SERVICE_DEGRADED, DEGRADED_MESSAGE);
        } catch (RuntimeException e) {
            log.error("Session {}: turn failed for message '{}'", sessionId, request.getMessage(), e);
            return terminal(sessionId, TurnOutcome.FAILURE, FAILURE_MESSAGE);
        } finally {
            lock.unlock();
        }
    }

    public void reset(String sessionId) {
        Lock lock = sessionContextService.lockFor(sessionId);
        lock.lock();
        try {
            sessionContextService.delete(sessionId);
            log.info("Session {} reset", sessionId);
        } finally {
            lock.unlock();
        }
    }

    public StoreHealthResponse health() {
        return sessionContextService.health();
    }

    private TurnResponse terminal(String sessionId, TurnOutcome outcome, String message) {
        return TurnResponse.builder()
                .sessionId(sessionId)
                .outcome(outcome)
                .message(message)
                .storeMode(sessionContextService.mode())
                .build();
    }
}
