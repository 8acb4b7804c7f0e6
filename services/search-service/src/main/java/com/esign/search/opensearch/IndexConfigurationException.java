package com.esign.search.opensearch;

/**
 * Raised while ensuring indices when a definition cannot be applied.
 */
public class IndexConfigurationException extends RuntimeException {
    public IndexConfigurationException(String message) {
        super(message);
    }

    public IndexConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
