package com.semsearch.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON-file backed store. The whole document is kept in memory and rewritten atomically after every upsert.
 *
 * <p>Every file row carries its embedding as a float32 blob. When a vector index type other than
 * {@link VectorIndexType#NONE} is configured, embeddings are also placed in a dimension-bound {@link VectorIndex}
 * that serves retrieval; otherwise retrieval scans the blobs linearly.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorStore.class);

    private final Path path;
    private final VectorIndexType indexType;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, String> idByPath = new HashMap<>();
    private VectorIndex vectorIndex;

    private LocalJsonVectorStore(Path path, VectorIndexType indexType) {
        this.path = path;
        this.indexType = indexType;
    }

    /**
     * Opens the store at {@code path}, creating an empty one when the file does not exist yet.
     *
     * @throws StorageException when the file exists but cannot be read
     */
    public static LocalJsonVectorStore open(Path path, VectorIndexType indexType) {
        LocalJsonVectorStore store = new LocalJsonVectorStore(path.toAbsolutePath(), indexType);
        store.load();
        return store;
    }

    public static LocalJsonVectorStore inMemory(VectorIndexType indexType) {
        return new LocalJsonVectorStore(null, indexType);
    }

    @Override
    public synchronized void upsert(FileRecord record) {
        if (record == null || record.metadata() == null || record.id() == null || record.id().isBlank()) {
            throw new StorageException("Record must carry metadata with a non-blank id");
        }
        float[] embedding = record.embedding();
        if (embedding == null || embedding.length == 0) {
            throw new StorageException("Invalid embedding data for " + record.id() + ": must be a non-empty array");
        }
        if (!Vectors.allFinite(embedding)) {
            throw new StorageException("Embedding for " + record.id() + " contains NaN or infinite values");
        }

        FileRecord effective = adoptExistingIdForPath(record);
        String id = effective.id();
        Snapshot before = snapshot();
        try {
            Entry previous = entries.get(id);
            if (previous != null && !previous.file().metadata().path().equals(effective.metadata().path())) {
                idByPath.remove(previous.file().metadata().path());
            }

            float[] copy = embedding.clone();
            entries.put(id, new Entry(effective.withoutEmbedding(), copy));
            idByPath.put(effective.metadata().path(), id);
            indexVector(id, copy);
            persist();
        } catch (RuntimeException e) {
            restore(before);
            throw e;
        }
    }

    @Override
    public synchronized Optional<IndexedFile> getById(String id) {
        return Optional.ofNullable(entries.get(id)).map(Entry::file);
    }

    @Override
    public synchronized Optional<IndexedFile> getByPath(String absolutePath) {
        String id = idByPath.get(absolutePath);
        return id == null ? Optional.empty() : getById(id);
    }

    @Override
    public synchronized Optional<float[]> embeddingFor(String id) {
        return Optional.ofNullable(entries.get(id)).map(entry -> entry.embedding().clone());
    }

    @Override
    public synchronized List<IndexedFile> listAll() {
        return entries.values().stream().map(Entry::file).toList();
    }

    @Override
    public synchronized int count() {
        return entries.size();
    }

    @Override
    public synchronized int vectorCount() {
        return vectorIndex == null ? 0 : vectorIndex.size();
    }

    @Override
    public synchronized boolean hasVectorIndex() {
        return vectorIndex != null;
    }

    @Override
    public synchronized int vectorDimension() {
        return vectorIndex == null ? 0 : vectorIndex.dimension();
    }

    @Override
    public synchronized List<ScoredFile> retrieveByEmbedding(float[] queryEmbedding, int limit) {
        if (queryEmbedding == null || queryEmbedding.length == 0) {
            throw new StorageException("Query embedding must be a non-empty array");
        }
        if (limit <= 0 || entries.isEmpty()) {
            return List.of();
        }
        if (vectorIndex != null) {
            return retrieveFromIndex(queryEmbedding, limit);
        }
        return linearScan(queryEmbedding, limit);
    }

    @Override
    public long databaseSize() {
        if (path == null || !Files.exists(path)) {
            return 0L;
        }
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new StorageException("Unable to stat store file " + path, e);
        }
    }

    @Override
    public String location() {
        return path == null ? ":memory:" : path.toString();
    }

    private List<ScoredFile> retrieveFromIndex(float[] queryEmbedding, int limit) {
        if (queryEmbedding.length != vectorIndex.dimension()) {
            throw new StorageException("Query embedding has " + queryEmbedding.length
                    + " dimensions but the vector index holds " + vectorIndex.dimension());
        }
        List<ScoredFile> results = new ArrayList<>();
        for (VectorIndex.Neighbor neighbor : vectorIndex.nearest(queryEmbedding, limit)) {
            Entry entry = entries.get(neighbor.id());
            if (entry != null) {
                results.add(new ScoredFile(entry.file(), 1d - neighbor.distance()));
            }
        }
        return results;
    }

    private List<ScoredFile> linearScan(float[] queryEmbedding, int limit) {
        return entries.values().stream()
                .filter(entry -> entry.embedding().length == queryEmbedding.length)
                .map(entry -> new ScoredFile(entry.file(), Vectors.similarity(queryEmbedding, entry.embedding())))
                .sorted(Comparator.comparingDouble(ScoredFile::similarity).reversed())
                .limit(limit)
                .toList();
    }

    private FileRecord adoptExistingIdForPath(FileRecord record) {
        String existingId = idByPath.get(record.metadata().path());
        if (existingId == null || existingId.equals(record.id())) {
            return record;
        }
        log.debug("Path {} already stored as {}; keeping that id for incoming {}",
                record.metadata().path(), existingId, record.id());
        return new FileRecord(record.metadata().withId(existingId), record.summary(), record.embedding());
    }

    private void indexVector(String id, float[] embedding) {
        if (indexType == VectorIndexType.NONE) {
            return;
        }
        if (vectorIndex != null && vectorIndex.dimension() != embedding.length) {
            log.warn("Embedding dimension changed from {} to {}; rebuilding vector index and dropping {} entries",
                    vectorIndex.dimension(), embedding.length, vectorIndex.size());
            vectorIndex = null;
        }
        if (vectorIndex == null) {
            vectorIndex = indexType.create(embedding.length);
        }
        vectorIndex.put(id, embedding);
    }

    private Snapshot snapshot() {
        return new Snapshot(
                new LinkedHashMap<>(entries),
                new HashMap<>(idByPath),
                vectorIndex,
                vectorIndex == null ? Set.of() : vectorIndex.ids());
    }

    /**
     * Puts memory back to {@code before}. The index is rebuilt because it was updated in place.
     */
    private void restore(Snapshot before) {
        entries.clear();
        entries.putAll(before.entries());
        idByPath.clear();
        idByPath.putAll(before.idByPath());
        if (before.index() == null) {
            vectorIndex = null;
            return;
        }
        VectorIndex rebuilt = indexType.create(before.index().dimension());
        for (String indexedId : before.indexedIds()) {
            Entry entry = entries.get(indexedId);
            if (entry != null) {
                rebuilt.put(indexedId, entry.embedding());
            }
        }
        vectorIndex = rebuilt;
    }

    private void load() {
        if (!Files.exists(path)) {
            return;
        }
        StoreDocument document;
        try {
            document = mapper.readValue(path.toFile(), StoreDocument.class);
        } catch (IOException e) {
            throw new StorageException("Unable to read store file " + path, e);
        }
        if (document.files() != null) {
            for (StoreDocument.StoredFile stored : document.files()) {
                String id = stored.metadata().id();
                entries.put(id, new Entry(new IndexedFile(stored.metadata(), stored.summary()), Vectors.fromBlob(stored.embedding())));
                idByPath.put(stored.metadata().path(), id);
            }
        }
        restoreIndex(document.vectorIndex());
        log.debug("Loaded {} files from {} (vector index: {})", entries.size(), path,
                vectorIndex == null ? "none" : vectorIndex.type() + "/" + vectorIndex.dimension());
    }

    private void restoreIndex(StoreDocument.IndexState state) {
        if (state == null || indexType == VectorIndexType.NONE || state.dimension() <= 0) {
            return;
        }
        vectorIndex = indexType.create(state.dimension());
        if (state.ids() == null) {
            return;
        }
        for (String id : state.ids()) {
            Entry entry = entries.get(id);
            if (entry != null && entry.embedding().length == state.dimension()) {
                vectorIndex.put(id, entry.embedding());
            }
        }
    }

    private void persist() {
        if (path == null) {
            return;
        }
        List<StoreDocument.StoredFile> files = entries.values().stream()
                .map(entry -> new StoreDocument.StoredFile(entry.file().metadata(), entry.file().summary(), Vectors.toBlob(entry.embedding())))
                .toList();
        StoreDocument.IndexState state = vectorIndex == null
                ? null
                : new StoreDocument.IndexState(vectorIndex.type(), vectorIndex.dimension(), vectorIndex.ids().stream().sorted().toList());
        StoreDocument document = new StoreDocument(StoreDocument.CURRENT_VERSION, files, state);
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageException("Unable to write store file " + path, e);
        }
    }

    private record Snapshot(Map<String, Entry> entries, Map<String, String> idByPath, VectorIndex index, Set<String> indexedIds) {
    }

    private record Entry(IndexedFile file, float[] embedding) {
    }
}
