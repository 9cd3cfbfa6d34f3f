package com.pinclick.copilot.model;

import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

public enum PossessionStatus {
    READY_TO_MOVE("Ready to Move"),
    UNDER_CONSTRUCTION("Under Construction"),
    NEW_LAUNCH("New Launch");

    private final String label;

    PossessionStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts display labels and common shorthands such as "RTMI", "ready-to-move" or "UC".
     */
    public static Optional<PossessionStatus> fromLabel(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        if (key.startsWith("ready") || key.equals("rtmi") || key.equals("rtm")) {
            return Optional.of(READY_TO_MOVE);
        }
        if (key.startsWith("under") || key.equals("uc")) {
            return Optional.of(UNDER_CONSTRUCTION);
        }
        if (key.contains("launch")) {
            return Optional.of(NEW_LAUNCH);
        }
        return Optional.empty();
    }
}
