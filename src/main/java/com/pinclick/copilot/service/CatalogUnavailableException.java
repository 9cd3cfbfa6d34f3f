package com.pinclick.copilot.service;

/**
 * The catalog store could not answer a query (missing table or column, connection loss).
 * Never converted into an empty result.
 */
public class CatalogUnavailableException extends RuntimeException {
    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
