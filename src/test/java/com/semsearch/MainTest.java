package com.semsearch;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private Path configPath;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void writeConfig() throws Exception {
        configPath = tempDir.resolve("semsearch.yml");
        Files.writeString(configPath, """
                provider:
                  type: local
                  localDimension: 48
                storage:
                  path: %s
                  vectorIndex: bucketed
                """.formatted(tempDir.resolve("index.json").toString().replace('\\', '/')));
    }

    @Test
    void shouldIndexThenSearchThenReportStatus() throws Exception {
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(docs.resolve("rust.md"), "Ownership and borrowing rules in Rust.");
        Files.writeString(docs.resolve("soup.txt"), "Tomato soup recipe with basil.");

        assertEquals(0, run("--mode", "index", "--path", docs.toString(), "--concurrency", "2"));
        assertTrue(out.toString().contains("Indexed 2 of 2 files"));

        assertEquals(0, run("--mode", "search", "--query", "tomato basil", "--top-k", "1"));
        assertTrue(out.toString().contains("soup.txt"));
        assertTrue(out.toString().contains("score=100"));

        assertEquals(0, run("--mode", "status"));
        assertTrue(out.toString().contains("Documents:       2"));
        assertTrue(out.toString().contains("Index coverage:  100%"));
    }

    @Test
    void shouldNotSuggestReindexWhenVectorIndexIsDisabled() throws Exception {
        Files.writeString(configPath, """
                provider:
                  type: local
                  localDimension: 48
                storage:
                  path: %s
                  vectorIndex: none
                """.formatted(tempDir.resolve("plain.json").toString().replace('\\', '/')));
        Path docs = Files.createDirectories(tempDir.resolve("plain-docs"));
        Files.writeString(docs.resolve("notes.md"), "Notes about gardening.");

        assertEquals(0, run("--mode", "index", "--path", docs.toString()));
        assertEquals(0, run("--mode", "status"));

        assertTrue(out.toString().contains("Index coverage:  0%"));
        assertTrue(out.toString().contains("Vector index disabled"));
        assertFalse(out.toString().contains("Re-index"));
    }

    @Test
    void shouldRejectInvalidSearchInput() {
        assertEquals(2, run("--mode", "search"));
        assertTrue(err.toString().contains("--query is required"));
        assertEquals(2, run("--mode", "search", "--query", "x", "--min-similarity", "1.5"));
        assertEquals(2, run("--mode", "search", "--query", "x", "--min-score", "-1"));
        assertEquals(2, run("--mode", "search", "--query", "x", "--top-k", "0"));
        assertEquals(2, run("--mode", "explode"));
    }

    @Test
    void shouldReportMissingRecord() {
        assertEquals(1, run("--mode", "info", "--id", "missing"));
        assertTrue(out.toString().contains("Not found: missing"));
    }

    @Test
    void shouldExplainMissingAzureSettings() throws Exception {
        Files.writeString(configPath, "provider:\n  type: azure-openai\n");

        assertEquals(2, run("--mode", "status"));
        assertTrue(err.toString().contains("endpoint"));
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = new CommandLine(new Main(Map.of()));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(prepend(args));
    }

    private String[] prepend(String... args) {
        String[] all = new String[args.length + 2];
        all[0] = "--config";
        all[1] = configPath.toString();
        System.arraycopy(args, 0, all, 2, args.length);
        return all;
    }
}
