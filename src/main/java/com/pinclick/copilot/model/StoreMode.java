package com.pinclick.copilot.model;

/**
 * Active session storage mode. IN_MEMORY is a degraded, process-local mode.
 */
public enum StoreMode {
    DURABLE,
    IN_MEMORY
}
