package com.app.cinematch.service;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.embedding.EmbeddingStore;
import com.app.cinematch.exception.NotEmbeddedException;
import com.app.cinematch.model.InteractionAction;
import com.app.cinematch.model.InteractionRecord;
import com.app.cinematch.model.SimilarMovie;
import com.app.cinematch.monitoring.RecommendationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class SimilarityService {

    private final EmbeddingStore embeddingStore;
    private final InteractionReader interactionReader;
    private final RecommendationMetrics metrics;

    /**
     * Nearest neighbours of a movie by raw dot product.
     *
     * @throws NotEmbeddedException if the movie has no embedding row
     */
    public List<SimilarMovie> similarItems(long movieId, int n, Set<Long> exclude) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        Set<Long> excluded = exclude != null ? exclude : Set.of();
        long startTime = System.currentTimeMillis();
        EmbeddingSnapshot snapshot = embeddingStore.load();

        OptionalInt queryRow = snapshot.getMapping().rowOf(movieId);
        if (queryRow.isEmpty()) {
            metrics.recordSimilarityLookup(movieId, false, 0, System.currentTimeMillis() - startTime);
            throw new NotEmbeddedException(movieId);
        }

        double[] similarities = snapshot.getMatrix().multiply(snapshot.getMatrix().row(queryRow.getAsInt()));

        // Most similar first, lower row on ties
        Integer[] order = new Integer[similarities.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> {
            int bySimilarity = Double.compare(similarities[b], similarities[a]);
            return bySimilarity != 0 ? bySimilarity : Integer.compare(a, b);
        });

        List<SimilarMovie> results = new ArrayList<>(Math.min(n, similarities.length));
        for (int row : order) {
            if (results.size() >= n) {
                break;
            }
            Optional<Long> candidate = snapshot.getMapping().movieAt(row);
            if (candidate.isEmpty() || candidate.get() == movieId || excluded.contains(candidate.get())) {
                continue;
            }
            results.add(SimilarMovie.builder()
                    .movieId(candidate.get())
                    .similarity(similarities[row])
                    .build());
        }

        metrics.recordSimilarityLookup(movieId, true, results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    /**
     * Nearest neighbours of a movie that the user has not watched yet.
     */
    public List<SimilarMovie> similarItemsUnwatched(long movieId, int n, long userId) {
        Set<Long> watched = interactionReader.get(userId).stream()
                .filter(r -> r.getAction() == InteractionAction.WATCH)
                .map(InteractionRecord::getMovieId)
                .collect(Collectors.toSet());
        log.debug("Excluding {} watched movies for user {}", watched.size(), userId);
        return similarItems(movieId, n, watched);
    }
}
