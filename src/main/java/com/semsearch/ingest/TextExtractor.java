package com.semsearch.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads at most {@code maxBytes} bytes from the start of a file and decodes them as UTF-8. A multi-byte character
 * cut by the limit is dropped; any other invalid byte sequence fails the extraction.
 */
public class TextExtractor {

    public ExtractedText extract(Path file, int maxBytes) {
        int limit = maxBytes <= 0 ? Integer.MAX_VALUE - 8 : maxBytes;
        long size;
        byte[] prefix;
        try (InputStream in = Files.newInputStream(file)) {
            size = Files.size(file);
            prefix = in.readNBytes(limit);
        } catch (IOException e) {
            throw new ExtractionException("Unable to read " + file, e);
        }

        boolean truncated = size > prefix.length;
        int usable = truncated ? completeSequenceLength(prefix) : prefix.length;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(prefix, 0, usable)).toString();
            return new ExtractedText(text, truncated, size);
        } catch (CharacterCodingException e) {
            throw new ExtractionException(file + " is not valid UTF-8 text", e);
        }
    }

    /**
     * Length of {@code bytes} without a trailing, incomplete UTF-8 sequence.
     */
    static int completeSequenceLength(byte[] bytes) {
        int end = bytes.length;
        int lead = end - 1;
        while (lead >= 0 && end - lead <= 4 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) {
            return end;
        }
        int expected = sequenceLength(bytes[lead]);
        if (expected > 0 && end - lead < expected) {
            return lead;
        }
        return end;
    }

    private static int sequenceLength(byte lead) {
        int value = lead & 0xFF;
        if (value < 0x80) {
            return 1;
        }
        if ((value & 0xE0) == 0xC0) {
            return 2;
        }
        if ((value & 0xF0) == 0xE0) {
            return 3;
        }
        if ((value & 0xF8) == 0xF0) {
            return 4;
        }
        return 0;
    }
}
