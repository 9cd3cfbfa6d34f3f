package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of refusal reasons. Each carries the only message a buyer ever sees for it.
 */
public enum RefusalReason {
    UNSUPPORTED_INTENT("unsupported_intent",
            "I can only help with questions about our listed projects, their pricing, configurations, locations and site visits."),
    FUTURE_PREDICTION("unsupported_intent",
            "I cannot provide predictions about future property values, ROI, or market trends."),
    LEGAL_ADVICE("unsupported_intent",
            "I cannot provide legal or financial advice. Please consult with appropriate professionals."),
    NO_RELEVANT_INFO("no_relevant_info",
            "This information is not available in the project documents or approved sources."),
    INSUFFICIENT_CONFIDENCE("insufficient_confidence",
            "I cannot provide a confident answer based on the available information."),
    CONFLICTING_INFO("conflicting_info",
            "I found conflicting information in the sources. Please contact our sales team for clarification.");

    private final String code;
    private final String message;

    RefusalReason(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
