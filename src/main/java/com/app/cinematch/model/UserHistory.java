package com.app.cinematch.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A user's interactions grouped the way the signals consume them:
 * watch events, explicit ratings (latest wins) and skips.
 * Watchlist entries carry no signal.
 */
@Getter
public final class UserHistory {

    public static final double DISLIKE_THRESHOLD = 5.0;

    private final List<WatchEvent> watched;
    private final Map<Long, Double> ratings;
    private final List<Long> skipped;

    private UserHistory(List<WatchEvent> watched, Map<Long, Double> ratings, List<Long> skipped) {
        this.watched = Collections.unmodifiableList(watched);
        this.ratings = Collections.unmodifiableMap(ratings);
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public static UserHistory from(List<InteractionRecord> records) {
        List<WatchEvent> watched = new ArrayList<>();
        Map<Long, Double> ratings = new LinkedHashMap<>();
        List<Long> skipped = new ArrayList<>();

        for (InteractionRecord record : records) {
            if (record.getAction() == null) {
                continue;
            }
            switch (record.getAction()) {
                case WATCH -> watched.add(new WatchEvent(record.getMovieId(), record.getTimestamp()));
                case RATE -> {
                    if (record.getRating() != null) {
                        ratings.put(record.getMovieId(), record.getRating());
                    }
                }
                case SKIP -> skipped.add(record.getMovieId());
                case WATCHLIST -> {
                    // no signal
                }
            }
        }
        return new UserHistory(watched, ratings, skipped);
    }

    public int watchCount() {
        return watched.size();
    }

    public boolean isColdStart() {
        return watched.isEmpty() && skipped.isEmpty();
    }

    public List<Long> watchedMovieIdList() {
        List<Long> ids = new ArrayList<>(watched.size());
        for (WatchEvent event : watched) {
            ids.add(event.getMovieId());
        }
        return ids;
    }

    public Set<Long> watchedMovieIds() {
        return new LinkedHashSet<>(watchedMovieIdList());
    }

    /**
     * Skipped movies followed by movies rated below {@value #DISLIKE_THRESHOLD}.
     */
    public List<Long> dislikedMovieIds() {
        List<Long> disliked = new ArrayList<>(skipped);
        ratings.forEach((movieId, rating) -> {
            if (rating < DISLIKE_THRESHOLD) {
                disliked.add(movieId);
            }
        });
        return disliked;
    }

    public Double ratingOf(long movieId) {
        return ratings.get(movieId);
    }

    @Getter
    public static final class WatchEvent {
        private final long movieId;
        private final Instant timestamp;

        public WatchEvent(long movieId, Instant timestamp) {
            this.movieId = movieId;
            this.timestamp = timestamp;
        }
    }
}
