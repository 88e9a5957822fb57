package com.app.cinematch.support;

import com.app.cinematch.embedding.EmbeddingMatrix;
import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.embedding.EmbeddingStore;
import com.app.cinematch.embedding.IndexMapping;
import com.app.cinematch.model.InteractionAction;
import com.app.cinematch.model.InteractionRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small hand-built catalogs shared by engine tests.
 */
public final class EngineFixtures {

    public static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");
    public static final long USER = 42L;

    /**
     * Five unit vectors in 3-D, movie ids 1..5 on rows 0..4.
     * <pre>
     * 1: (1, 0, 0)      2: (0.8, 0.6, 0)   3: (0, 1, 0)
     * 4: (0.6, 0, 0.8)  5: (0, 0, 1)
     * </pre>
     */
    public static final float[][] FIVE_MOVIES = {
            {1f, 0f, 0f},
            {0.8f, 0.6f, 0f},
            {0f, 1f, 0f},
            {0.6f, 0f, 0.8f},
            {0f, 0f, 1f}
    };

    private EngineFixtures() {
    }

    public static EmbeddingSnapshot snapshot(float[][] vectors, long... movieIds) {
        return new EmbeddingSnapshot(EmbeddingMatrix.of(vectors), new IndexMapping(index(movieIds), vectors.length));
    }

    public static EmbeddingSnapshot fiveMovies() {
        return snapshot(FIVE_MOVIES, 1, 2, 3, 4, 5);
    }

    public static EmbeddingStore store(float[][] vectors, long... movieIds) {
        return new EmbeddingStore(() -> EmbeddingMatrix.of(vectors), () -> index(movieIds));
    }

    public static Map<Long, Integer> index(long... movieIds) {
        Map<Long, Integer> index = new LinkedHashMap<>();
        for (int row = 0; row < movieIds.length; row++) {
            index.put(movieIds[row], row);
        }
        return index;
    }

    public static InteractionRecord watch(long movieId, Instant at) {
        return record(movieId, InteractionAction.WATCH, null, at);
    }

    public static InteractionRecord rate(long movieId, double rating) {
        return record(movieId, InteractionAction.RATE, rating, NOW);
    }

    public static InteractionRecord skip(long movieId) {
        return record(movieId, InteractionAction.SKIP, null, NOW);
    }

    public static InteractionRecord watchlist(long movieId) {
        return record(movieId, InteractionAction.WATCHLIST, null, NOW);
    }

    public static Instant daysAgo(long days) {
        return NOW.minusSeconds(days * 86_400L);
    }

    private static InteractionRecord record(long movieId, InteractionAction action, Double rating, Instant at) {
        return InteractionRecord.builder()
                .userId(USER)
                .movieId(movieId)
                .action(action)
                .rating(rating)
                .timestamp(at)
                .build();
    }
}
