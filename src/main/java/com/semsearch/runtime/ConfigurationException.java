package com.semsearch.runtime;

import com.semsearch.SemanticSearchException;

/**
 * Missing or invalid settings detected before any store operation runs.
 */
public class ConfigurationException extends SemanticSearchException {
    public ConfigurationException(String message) {
        super(message);
    }
}
