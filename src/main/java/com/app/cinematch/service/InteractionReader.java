package com.app.cinematch.service;

import com.app.cinematch.model.InteractionRecord;

import java.util.List;

/**
 * Read access to a user's interaction history.
 */
public interface InteractionReader {

    List<InteractionRecord> get(long userId);
}
