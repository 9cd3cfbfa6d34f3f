package com.pinclick.copilot.model;

/**
 * Which rung of the search ladder produced a result list.
 */
public enum FallbackStage {
    EXACT,
    CONFIGURATION_FLEX,
    LOCALITY_PRIORITY,
    NEAREST_BUDGET,
    BUDGET_RELAXATION,
    RADIUS_PIVOT,
    NONE
}
