package com.semsearch.ingest;

/**
 * @param truncated true when the file holds more bytes than were read
 */
public record ExtractedText(String text, boolean truncated, long sizeBytes) {
}
