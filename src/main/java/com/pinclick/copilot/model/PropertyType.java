package com.pinclick.copilot.model;

import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

public enum PropertyType {
    APARTMENT,
    VILLA,
    ROW_HOUSE,
    PLOT;

    /**
     * Lenient parse of caller or model supplied labels ("Apartment", "row-house", "villas").
     */
    public static Optional<PropertyType> fromLabel(String label) {
        if (!StringUtils.hasText(label)) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (key.endsWith("S") && !key.equals("S")) {
            key = key.substring(0, key.length() - 1);
        }
        if (key.equals("FLAT")) {
            return Optional.of(APARTMENT);
        }
        if (key.equals("ROWHOUSE")) {
            return Optional.of(ROW_HOUSE);
        }
        for (PropertyType type : values()) {
            if (type.name().equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
