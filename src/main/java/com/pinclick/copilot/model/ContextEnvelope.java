package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Unit persisted by the session store: a state snapshot and when it was last touched.
 */
public record ContextEnvelope(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("state") ConversationState state,
        @JsonProperty("last_touched") Instant lastTouched
) {
}
