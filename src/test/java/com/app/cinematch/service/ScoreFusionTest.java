package com.app.cinematch.service;

import com.app.cinematch.embedding.IndexMapping;
import com.app.cinematch.signal.Signal;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreFusionTest {

    private final ScoreFusion fusion = new ScoreFusion();

    @Test
    void blendsSignalsWithTierWeights() {
        Map<Signal, double[]> vectors = new EnumMap<>(Signal.class);
        vectors.put(Signal.INTEREST, new double[]{1, 0});
        vectors.put(Signal.DISCOVERY, new double[]{1, 0});
        vectors.put(Signal.COLLABORATIVE, new double[]{0, 1});
        vectors.put(Signal.CATEGORY, new double[]{0, 1});

        double[] combined = fusion.fuse(vectors, WeightTier.RICH, 2);

        assertThat(combined).containsExactly(new double[]{0.7, 0.3}, within(1e-12));
    }

    @Test
    void rejectsMissingOrMisSizedVectors() {
        Map<Signal, double[]> vectors = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            vectors.put(signal, new double[3]);
        }

        assertThatThrownBy(() -> fusion.fuse(vectors, WeightTier.SPARSE, 4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 4");

        vectors.remove(Signal.CATEGORY);
        assertThatThrownBy(() -> fusion.fuse(vectors, WeightTier.SPARSE, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CATEGORY");
    }

    @Test
    void candidatesSkipWatchedAndUnmappedRows() {
        // row 2 has no movie
        IndexMapping mapping = new IndexMapping(Map.of(10L, 0, 11L, 1, 13L, 3, 14L, 4), 5);

        int[] candidates = fusion.candidateRows(mapping, Set.of(11L, 99L));

        assertThat(candidates).containsExactly(0, 3, 4);
    }
}
