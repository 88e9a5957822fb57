package com.app.cinematch.embedding;

import com.app.cinematch.exception.DataUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Owns the embedding matrix and index for the lifetime of the process.
 * <p>
 * {@link #load()} reads both sources once, validates them and publishes the
 * pair atomically. Later calls return the cached snapshot without locking.
 * A failed load publishes nothing, so the next call tries again.
 */
@Slf4j
public class EmbeddingStore {

    private final EmbeddingSource embeddingSource;
    private final IndexSource indexSource;
    private final Object loadLock = new Object();

    private volatile EmbeddingSnapshot snapshot;

    public EmbeddingStore(EmbeddingSource embeddingSource, IndexSource indexSource) {
        this.embeddingSource = embeddingSource;
        this.indexSource = indexSource;
    }

    public EmbeddingSnapshot load() {
        EmbeddingSnapshot current = snapshot;
        if (current != null) {
            return current;
        }

        synchronized (loadLock) {
            if (snapshot == null) {
                snapshot = readSnapshot();
            }
            return snapshot;
        }
    }

    public boolean isLoaded() {
        return snapshot != null;
    }

    private EmbeddingSnapshot readSnapshot() {
        long startTime = System.currentTimeMillis();

        EmbeddingMatrix matrix = embeddingSource.load();
        if (matrix == null || matrix.rows() == 0) {
            throw new DataUnavailableException("Embedding matrix is empty");
        }

        Map<Long, Integer> index = indexSource.load();
        if (index == null || index.isEmpty()) {
            throw new DataUnavailableException("Embedding index is empty");
        }

        IndexMapping mapping = new IndexMapping(index, matrix.rows());
        if (mapping.size() < matrix.rows()) {
            log.warn("{} of {} embedding rows have no movie id and will never be recommended",
                    matrix.rows() - mapping.size(), matrix.rows());
        }

        log.info("Embeddings loaded: {} movies, dimension {} ({}ms)",
                mapping.size(), matrix.dimension(), System.currentTimeMillis() - startTime);
        return new EmbeddingSnapshot(matrix, mapping);
    }
}
