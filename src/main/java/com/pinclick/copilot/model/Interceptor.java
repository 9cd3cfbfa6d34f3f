package com.pinclick.copilot.model;

/**
 * Keyword matches on the raw utterance that route a turn without consulting the classifier.
 */
public enum Interceptor {
    NONE(null),
    RESET(Intent.PROPERTY_SEARCH),
    SHOW_MORE(Intent.PROPERTY_SEARCH),
    NEARBY(Intent.CONTEXTUAL_QUERY),
    SITE_VISIT(Intent.SITE_VISIT),
    PROJECT_MENTION(Intent.PROJECT_DETAILS);

    private final Intent impliedIntent;

    Interceptor(Intent impliedIntent) {
        this.impliedIntent = impliedIntent;
    }

    public Intent impliedIntent() {
        return impliedIntent;
    }
}
