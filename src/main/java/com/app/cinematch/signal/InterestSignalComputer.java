package com.app.cinematch.signal;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.model.UserHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Content interest: similarity to a time-decayed, rating-weighted centroid of
 * the user's watched movies.
 */
@Component
@Slf4j
public class InterestSignalComputer implements SignalComputer {

    static final double NEUTRAL_RATING = 5.0;
    private static final long SECONDS_PER_DAY = 86_400L;

    private final Clock clock;
    private final double halfLifeDays;

    public InterestSignalComputer(
            Clock clock,
            @Value("${cinematch.signals.interest-half-life-days:14}") double halfLifeDays) {
        if (halfLifeDays <= 0) {
            throw new IllegalArgumentException("Half-life must be positive: " + halfLifeDays);
        }
        this.clock = clock;
        this.halfLifeDays = halfLifeDays;
    }

    @Override
    public Signal signal() {
        return Signal.INTEREST;
    }

    @Override
    public double[] compute(UserHistory history, EmbeddingSnapshot snapshot) {
        Instant now = clock.instant();
        List<Integer> rows = new ArrayList<>();
        List<Double> weights = new ArrayList<>();

        for (UserHistory.WatchEvent event : history.getWatched()) {
            OptionalInt row = snapshot.getMapping().rowOf(event.getMovieId());
            if (row.isEmpty()) {
                continue;
            }
            double timeWeight = Math.pow(0.5, daysSince(event.getTimestamp(), now) / halfLifeDays);
            Double rating = history.ratingOf(event.getMovieId());
            double ratingWeight = (rating != null ? rating : NEUTRAL_RATING) / 10.0;

            rows.add(row.getAsInt());
            weights.add(timeWeight * ratingWeight);
        }

        double total = weights.stream().mapToDouble(Double::doubleValue).sum();
        if (rows.isEmpty() || total <= 0) {
            return new double[snapshot.rows()];
        }

        double[] normalized = new double[weights.size()];
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] = weights.get(i) / total;
        }

        double[] centroid = snapshot.getMatrix().weightedAverage(rows, normalized);
        log.debug("Interest centroid built from {} watched movies", rows.size());
        return snapshot.getMatrix().multiply(centroid);
    }

    // Whole days elapsed, rounded down. Missing timestamps count as "now".
    private static long daysSince(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return 0;
        }
        return Math.floorDiv(Duration.between(timestamp, now).getSeconds(), SECONDS_PER_DAY);
    }
}
