package com.app.cinematch.signal;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.embedding.IndexMapping;
import com.app.cinematch.model.UserHistory;
import com.app.cinematch.service.CatalogMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Genre preference: share of watched movies carrying each genre, summed over a
 * row's genres and scaled so the best row scores 1.0.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CategorySignalComputer implements SignalComputer {

    private final CatalogMetadata catalogMetadata;

    @Override
    public Signal signal() {
        return Signal.CATEGORY;
    }

    @Override
    public double[] compute(UserHistory history, EmbeddingSnapshot snapshot) {
        double[] scores = new double[snapshot.rows()];
        if (history.getWatched().isEmpty()) {
            return scores;
        }

        Map<String, Integer> genreCounts = new HashMap<>();
        for (UserHistory.WatchEvent event : history.getWatched()) {
            for (String genre : catalogMetadata.genres(event.getMovieId())) {
                genreCounts.merge(genre, 1, Integer::sum);
            }
        }
        if (genreCounts.isEmpty()) {
            return scores;
        }

        double totalWatched = history.watchCount();
        Map<String, Double> preferences = new HashMap<>();
        genreCounts.forEach((genre, count) -> preferences.put(genre, count / totalWatched));
        log.debug("Genre preferences: {}", preferences);

        IndexMapping mapping = snapshot.getMapping();
        double max = 0.0;
        for (int row = 0; row < scores.length; row++) {
            Optional<Long> movieId = mapping.movieAt(row);
            if (movieId.isEmpty()) {
                continue;
            }
            double score = 0.0;
            for (String genre : catalogMetadata.genres(movieId.get())) {
                score += preferences.getOrDefault(genre, 0.0);
            }
            scores[row] = score;
            max = Math.max(max, score);
        }

        if (max > 0) {
            for (int row = 0; row < scores.length; row++) {
                scores[row] /= max;
            }
        }
        return scores;
    }
}
