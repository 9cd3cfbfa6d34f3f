package com.pinclick.copilot.model;

/**
 * Coarse result of one turn. The caller formats the reply from it.
 */
public enum TurnOutcome {
    RESULTS,
    NO_MORE_RESULTS,
    GATHERING_REQUIREMENTS,
    PROJECT_DETAILS,
    CLARIFY_PROJECT,
    NO_ANCHOR,
    OBJECTION,
    SITE_VISIT_HANDOFF,
    ACKNOWLEDGED,
    REFUSED,
    RESET,
    SERVICE_DEGRADED,
    SESSION_BUSY,
    FAILURE
}
