package com.semsearch;

/**
 * Root of the unchecked failures raised by indexing, storage, provider and search code.
 */
public class SemanticSearchException extends RuntimeException {
    public SemanticSearchException(String message) {
        super(message);
    }

    public SemanticSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
