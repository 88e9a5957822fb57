package com.app.cinematch.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-movie metadata imported alongside the embeddings. {@code genres} is a
 * JSON array of genre names, e.g. {@code ["Action", "Drama"]}.
 */
@Entity
@Table(name = "movie_metadata")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieMetadata {

    @Id
    @Column(name = "movie_id")
    private Long movieId;

    @Convert(converter = GenreListConverter.class)
    @Column(columnDefinition = "json")
    private List<String> genres;

    @Column(name = "release_date", length = 20)
    private String releaseDate;

    public Set<String> getGenreSet() {
        if (genres == null || genres.isEmpty()) {
            return Set.of();
        }
        return genres.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
