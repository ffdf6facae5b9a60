package com.semsearch.ingest;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileTypesTest {

    private final FileTypes defaults = FileTypes.defaults();

    @Test
    void shouldAcceptKnownTextExtensionsCaseInsensitively() {
        assertTrue(defaults.isTextLike(Path.of("notes/README.MD")));
        assertTrue(defaults.isTextLike(Path.of("src/app.tsx")));
        assertTrue(defaults.isTextLike(Path.of("deploy.ps1")));
        assertFalse(defaults.isTextLike(Path.of("image.png")));
        assertFalse(defaults.isTextLike(Path.of("Makefile")));
        assertFalse(defaults.isTextLike(Path.of("trailing.")));
    }

    @Test
    void shouldHonourConfiguredExtensions() {
        FileTypes custom = new FileTypes(List.of(".LOG", " adoc ", ""));

        assertTrue(custom.isTextLike(Path.of("server.log")));
        assertTrue(custom.isTextLike(Path.of("guide.adoc")));
        assertFalse(custom.isTextLike(Path.of("notes.md")));
    }

    @Test
    void shouldHintMimeTypes() {
        assertEquals("text/markdown", FileTypes.mimeType(Path.of("a.md")));
        assertEquals("text/typescript", FileTypes.mimeType(Path.of("a.ts")));
        assertEquals("application/json", FileTypes.mimeType(Path.of("A.JSON")));
        assertNull(FileTypes.mimeType(Path.of("a.bin")));
        assertEquals("", FileTypes.extension(Path.of("noext")));
    }
}
