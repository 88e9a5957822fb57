package com.app.cinematch.service;

import com.app.cinematch.signal.Signal;

import java.util.EnumMap;
import java.util.Map;

/**
 * Signal blend chosen by how many movies a user has watched. Sparse histories
 * lean on collaborative and genre priors; rich ones on content interest and
 * discovery.
 */
public enum WeightTier {
    SPARSE(0.20, 0.10, 0.30, 0.40),
    MODERATE(0.35, 0.25, 0.25, 0.15),
    RICH(0.40, 0.30, 0.20, 0.10);

    static final int MODERATE_MIN_WATCHED = 5;
    static final int RICH_MIN_WATCHED = 20;
    private static final double SUM_TOLERANCE = 1e-9;

    private final Map<Signal, Double> weights;

    WeightTier(double interest, double discovery, double collaborative, double category) {
        double sum = interest + discovery + collaborative + category;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalStateException("Weights of tier " + name() + " sum to " + sum);
        }
        Map<Signal, Double> map = new EnumMap<>(Signal.class);
        map.put(Signal.INTEREST, interest);
        map.put(Signal.DISCOVERY, discovery);
        map.put(Signal.COLLABORATIVE, collaborative);
        map.put(Signal.CATEGORY, category);
        this.weights = map;
    }

    public static WeightTier forWatchCount(int watched) {
        if (watched < MODERATE_MIN_WATCHED) {
            return SPARSE;
        }
        if (watched < RICH_MIN_WATCHED) {
            return MODERATE;
        }
        return RICH;
    }

    public double weight(Signal signal) {
        return weights.get(signal);
    }
}
