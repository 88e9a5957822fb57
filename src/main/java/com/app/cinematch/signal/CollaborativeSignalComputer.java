package com.app.cinematch.signal;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.model.UserHistory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Item-item proxy: mean similarity of each row to every watched movie.
 */
@Component
public class CollaborativeSignalComputer implements SignalComputer {

    @Override
    public Signal signal() {
        return Signal.COLLABORATIVE;
    }

    @Override
    public double[] compute(UserHistory history, EmbeddingSnapshot snapshot) {
        List<Integer> watchedRows = snapshot.rowsOf(history.watchedMovieIdList());
        if (watchedRows.isEmpty()) {
            return new double[snapshot.rows()];
        }
        // mean of dot products == dot product with the mean
        return snapshot.getMatrix().multiply(snapshot.getMatrix().mean(watchedRows));
    }
}
