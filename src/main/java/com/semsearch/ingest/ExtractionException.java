package com.semsearch.ingest;

import com.semsearch.SemanticSearchException;

public class ExtractionException extends SemanticSearchException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
