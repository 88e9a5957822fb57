package com.app.cinematch.embedding;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;

/**
 * A fully validated matrix and its index, published together by {@link EmbeddingStore}.
 */
@Getter
@RequiredArgsConstructor
public final class EmbeddingSnapshot {

    private final EmbeddingMatrix matrix;
    private final IndexMapping mapping;

    public int rows() {
        return matrix.rows();
    }

    /**
     * Rows of the given movies in input order, skipping unembedded ones.
     * Duplicates are kept.
     */
    public List<Integer> rowsOf(Collection<Long> movieIds) {
        List<Integer> rows = new ArrayList<>(movieIds.size());
        for (Long movieId : movieIds) {
            OptionalInt row = mapping.rowOf(movieId);
            row.ifPresent(rows::add);
        }
        return rows;
    }
}
