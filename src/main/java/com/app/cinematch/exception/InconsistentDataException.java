package com.app.cinematch.exception;

/**
 * The index metadata does not agree with the embedding matrix
 * (row out of range, or two movies sharing a row).
 */
public class InconsistentDataException extends RecommendationEngineException {

    public InconsistentDataException(String message) {
        super(message);
    }
}
