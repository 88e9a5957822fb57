package com.app.cinematch.service;

import java.util.List;
import java.util.Set;

/**
 * Movie metadata the engine reads: genres for the category signal and
 * popularity for cold-start ordering.
 */
public interface CatalogMetadata {

    Set<String> genres(long movieId);

    double popularity(long movieId);

    /**
     * Up to {@code limit} movie ids ordered by popularity descending, ties by id ascending.
     */
    List<Long> mostPopular(int limit);
}
