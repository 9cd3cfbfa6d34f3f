package com.pinclick.copilot.model;

/**
 * What a transition does to the stored search result window.
 */
public enum ResultWindowAction {
    PAGINATE,
    REPLACE,
    KEEP
}
