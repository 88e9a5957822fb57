package com.app.cinematch.exception;

import lombok.Getter;

/**
 * A referenced movie has no embedding row. Callers treat this as
 * "feature unavailable for this item".
 */
@Getter
public class NotEmbeddedException extends RecommendationEngineException {

    private final long movieId;

    public NotEmbeddedException(long movieId) {
        super("Movie " + movieId + " has no embedding");
        this.movieId = movieId;
    }
}
