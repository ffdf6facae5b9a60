package com.semsearch.store;

import com.semsearch.SemanticSearchException;

public class StorageException extends SemanticSearchException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
