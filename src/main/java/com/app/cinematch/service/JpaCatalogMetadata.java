package com.app.cinematch.service;

import com.app.cinematch.model.Movie;
import com.app.cinematch.model.MovieMetadata;
import com.app.cinematch.repository.MovieMetadataRepository;
import com.app.cinematch.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog metadata backed by the {@code movies} table (popularity) and the
 * {@code movie_metadata} table (genres). Genres are read for the whole catalog
 * on first use and kept for the life of the process, like the embeddings they
 * are scored alongside.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaCatalogMetadata implements CatalogMetadata {

    private final MovieRepository movieRepository;
    private final MovieMetadataRepository movieMetadataRepository;

    private volatile Map<Long, Set<String>> genresByMovie;

    @Override
    public Set<String> genres(long movieId) {
        return genreIndex().getOrDefault(movieId, Set.of());
    }

    @Override
    @Transactional(readOnly = true)
    public double popularity(long movieId) {
        return movieRepository.findById(movieId)
                .map(Movie::getPopularity)
                .orElse(0.0);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> mostPopular(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return movieRepository.findByPopularityIsNotNullOrderByPopularityDescIdAsc(PageRequest.of(0, limit))
                .stream()
                .map(Movie::getId)
                .collect(Collectors.toList());
    }

    private Map<Long, Set<String>> genreIndex() {
        Map<Long, Set<String>> current = genresByMovie;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (genresByMovie == null) {
                Map<Long, Set<String>> index = new HashMap<>();
                for (MovieMetadata metadata : movieMetadataRepository.findAll()) {
                    Set<String> genres = metadata.getGenreSet();
                    if (!genres.isEmpty()) {
                        index.put(metadata.getMovieId(), genres);
                    }
                }
                log.info("Cached genres for {} movies", index.size());
                genresByMovie = index;
            }
            return genresByMovie;
        }
    }
}
