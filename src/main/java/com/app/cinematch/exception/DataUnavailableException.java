package com.app.cinematch.exception;

/**
 * The embedding matrix or its index metadata is missing or unreadable.
 * Fatal for every recommendation and similarity call.
 */
public class DataUnavailableException extends RecommendationEngineException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
