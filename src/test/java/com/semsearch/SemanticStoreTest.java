package com.semsearch;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsearch.ingest.IndexingStats;
import com.semsearch.runtime.AppConfig;
import com.semsearch.runtime.ConfigurationException;
import com.semsearch.search.SearchResult;
import com.semsearch.store.FileRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldIndexSearchAndDescribeWithLocalProvider() throws Exception {
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Path guide = Files.writeString(docs.resolve("guide.md"), "Vector databases store embeddings for similarity search.");
        Files.write(docs.resolve("logo.png"), new byte[] { 1, 2, 3 });
        SemanticStore store = SemanticStore.open(localConfig("flat"), Map.of());

        IndexingStats stats = store.indexPath(docs, store.defaultIndexingOptions());

        assertEquals(1, stats.totalFiles());
        assertEquals(1, stats.completed());
        assertEquals(1, store.count());
        assertEquals(1, store.vectorCount());
        assertTrue(store.hasVectorIndex());

        List<SearchResult> results = store.search("similarity search embeddings", store.defaultSearchOptions());
        assertEquals(1, results.size());
        SearchResult hit = results.get(0);
        assertEquals(guide.toAbsolutePath().normalize().toString(), hit.metadata().path());
        assertEquals(100, hit.score());
        assertTrue(hit.similarity() > 0);

        FileRecord record = store.info(hit.id()).orElseThrow();
        assertEquals(64, record.embedding().length);
        assertEquals("guide.md", record.metadata().filename());
        assertTrue(store.info("no-such-id").isEmpty());

        StoreStats storeStats = store.getStats();
        assertEquals(1, storeStats.totalDocuments());
        assertEquals(100, storeStats.vectorIndexCoverage());
        assertEquals(64, storeStats.vectorDimension());
        assertTrue(storeStats.databaseSize() > 0);
        assertEquals("local (64 dimensions)", storeStats.endpoint());

        SemanticStore reopened = SemanticStore.open(localConfig("flat"), Map.of());
        assertEquals(1, reopened.count());
        assertEquals(1, reopened.search("similarity search embeddings", reopened.defaultSearchOptions()).size());
    }

    @Test
    void shouldReportZeroCoverageWithoutVectorIndex() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "Plain text about gardening.");
        SemanticStore store = SemanticStore.open(localConfig("none"), Map.of());

        store.indexFile(tempDir.resolve("a.txt"));

        StoreStats stats = store.getStats();
        assertEquals(1, stats.totalDocuments());
        assertEquals(0, stats.vectorIndexCoverage());
        assertFalse(stats.hasVectorIndex());
        assertFalse(stats.fullyCovered());
        assertEquals(1, store.search("gardening", store.defaultSearchOptions()).size());
    }

    @Test
    void shouldRejectUnknownIndexType() {
        assertThrows(ConfigurationException.class, () -> SemanticStore.open(localConfig("hnsw"), Map.of()));
    }

    @Test
    void shouldRoundCoverage() {
        assertEquals(0, StoreStats.coverage(0, 0));
        assertEquals(67, StoreStats.coverage(2, 3));
        assertEquals(100, StoreStats.coverage(5, 5));
    }

    private AppConfig localConfig(String vectorIndex) {
        AppConfig config = new AppConfig();
        config.getProvider().setType("local");
        config.getProvider().setLocalDimension(64);
        config.getStorage().setPath(tempDir.resolve("store").resolve("index.json").toString());
        config.getStorage().setVectorIndex(vectorIndex);
        return config;
    }
}
