package com.app.cinematch.service;

import com.app.cinematch.embedding.IndexMapping;
import com.app.cinematch.signal.Signal;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Linear blend of signal vectors and the candidate filter applied before re-ranking.
 */
@Component
public class ScoreFusion {

    public double[] fuse(Map<Signal, double[]> vectors, WeightTier tier, int rows) {
        double[] combined = new double[rows];
        for (Signal signal : Signal.values()) {
            double[] vector = vectors.get(signal);
            if (vector == null) {
                throw new IllegalArgumentException("Missing vector for signal " + signal);
            }
            if (vector.length != rows) {
                throw new IllegalArgumentException(String.format(
                        "Signal %s has %d scores, expected %d", signal, vector.length, rows));
            }
            double weight = tier.weight(signal);
            for (int i = 0; i < rows; i++) {
                combined[i] += weight * vector[i];
            }
        }
        return combined;
    }

    /**
     * Rows, ascending, that map to a movie the user has not watched.
     */
    public int[] candidateRows(IndexMapping mapping, Set<Long> watchedMovieIds) {
        int[] buffer = new int[mapping.rowCount()];
        int count = 0;
        for (int row = 0; row < mapping.rowCount(); row++) {
            Optional<Long> movieId = mapping.movieAt(row);
            if (movieId.isPresent() && !watchedMovieIds.contains(movieId.get())) {
                buffer[count++] = row;
            }
        }
        int[] candidates = new int[count];
        System.arraycopy(buffer, 0, candidates, 0, count);
        return candidates;
    }
}
