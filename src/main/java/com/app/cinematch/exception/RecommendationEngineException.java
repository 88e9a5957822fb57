package com.app.cinematch.exception;

/**
 * Base type for failures raised by the recommendation engine.
 */
public class RecommendationEngineException extends RuntimeException {

    public RecommendationEngineException(String message) {
        super(message);
    }

    public RecommendationEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
