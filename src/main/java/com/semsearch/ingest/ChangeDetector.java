package com.semsearch.ingest;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.store.StorageException;
import com.semsearch.store.VectorStore;

/**
 * A file needs processing when the store has no record for its resolved absolute path, or when forced.
 */
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final VectorStore store;

    public ChangeDetector(VectorStore store) {
        this.store = store;
    }

    public boolean needsProcessing(Path file, boolean force) {
        if (force) {
            return true;
        }
        String resolved = file.toAbsolutePath().normalize().toString();
        try {
            return store.getByPath(resolved).isEmpty();
        } catch (StorageException e) {
            log.debug("Could not look up {}, processing it anyway", resolved, e);
            return true;
        }
    }
}
