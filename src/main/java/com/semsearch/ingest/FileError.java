package com.semsearch.ingest;

public record FileError(String path, String errorType, String message) {
}
