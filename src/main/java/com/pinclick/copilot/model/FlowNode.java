package com.pinclick.copilot.model;

public enum FlowNode {
    REQUIREMENT_GATHERING,
    SEARCH_RESULTS,
    PROJECT_DEEP_DIVE,
    RADIUS_PIVOT,
    OBJECTION_HANDLING,
    SITE_VISIT_HANDOFF;

    /**
     * The node a sales agent would normally steer towards next.
     */
    public FlowNode expectedFollowUp() {
        switch (this) {
            case REQUIREMENT_GATHERING:
            case OBJECTION_HANDLING:
                return SEARCH_RESULTS;
            case SEARCH_RESULTS:
            case RADIUS_PIVOT:
                return PROJECT_DEEP_DIVE;
            case PROJECT_DEEP_DIVE:
            case SITE_VISIT_HANDOFF:
            default:
                return SITE_VISIT_HANDOFF;
        }
    }
}
