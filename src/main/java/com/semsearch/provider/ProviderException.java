package com.semsearch.provider;

import com.semsearch.SemanticSearchException;

public class ProviderException extends SemanticSearchException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
