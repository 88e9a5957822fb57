package com.app.cinematch.embedding;

import java.util.Map;

/**
 * Supplies the movie id to embedding row mapping.
 */
@FunctionalInterface
public interface IndexSource {

    Map<Long, Integer> load();
}
