package com.app.cinematch.signal;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.model.UserHistory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Anti-preference: rewards movies far from what the user skipped or rated
 * below 5, min-max scaled into [0, 1].
 */
@Component
public class DiscoverySignalComputer implements SignalComputer {

    static final double EPSILON = 1e-8;

    @Override
    public Signal signal() {
        return Signal.DISCOVERY;
    }

    @Override
    public double[] compute(UserHistory history, EmbeddingSnapshot snapshot) {
        List<Integer> dislikedRows = snapshot.rowsOf(history.dislikedMovieIds());
        if (dislikedRows.isEmpty()) {
            return new double[snapshot.rows()];
        }

        double[] dislikedCentroid = snapshot.getMatrix().mean(dislikedRows);
        double[] scores = snapshot.getMatrix().multiply(dislikedCentroid);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < scores.length; i++) {
            scores[i] = -scores[i];
            min = Math.min(min, scores[i]);
            max = Math.max(max, scores[i]);
        }

        double range = max - min + EPSILON;
        for (int i = 0; i < scores.length; i++) {
            scores[i] = (scores[i] - min) / range;
        }
        return scores;
    }
}
