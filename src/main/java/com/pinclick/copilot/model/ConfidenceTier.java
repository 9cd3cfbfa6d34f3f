package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceTier {
    HIGH("High"),
    MEDIUM("Medium"),
    NOT_AVAILABLE("Not Available");

    private final String label;

    ConfidenceTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
