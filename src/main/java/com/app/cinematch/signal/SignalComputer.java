package com.app.cinematch.signal;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.model.UserHistory;

/**
 * Turns a user's history into one score per catalog row.
 * <p>
 * Implementations are stateless. The returned vector always has
 * {@code snapshot.rows()} entries and falls back to all zeros when the
 * history carries nothing for this signal.
 */
public interface SignalComputer {

    Signal signal();

    double[] compute(UserHistory history, EmbeddingSnapshot snapshot);
}
