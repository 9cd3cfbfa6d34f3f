package com.pinclick.copilot.model;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Turn-level intents the language classifier may return.
 */
public enum Intent {
    PROPERTY_SEARCH,
    PROJECT_DETAILS,
    MORE_INFO_REQUEST,
    SALES_OBJECTION,
    SITE_VISIT,
    CONTEXTUAL_QUERY,
    COMPARISON,
    GREETING,
    SCHEDULING,
    UNSUPPORTED,
    UNKNOWN;

    /**
     * Intents whose responses never carry project records.
     */
    public boolean isNonProperty() {
        return this == GREETING || this == SCHEDULING || this == UNSUPPORTED || this == UNKNOWN;
    }

    public static Intent fromLabel(String label) {
        if (!StringUtils.hasText(label)) {
            return UNKNOWN;
        }
        String key = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(key)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
