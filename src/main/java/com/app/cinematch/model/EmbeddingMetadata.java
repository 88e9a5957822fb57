package com.app.cinematch.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row written by the offline embedding job: which matrix row holds a movie's embedding.
 */
@Entity
@Table(name = "embedding_metadata")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingMetadata {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "movie_id", nullable = false, unique = true)
    private Long movieId;

    @Column(nullable = false)
    private String title;

    @Column(name = "embedding_index", nullable = false)
    private Integer embeddingIndex;

    @Column(length = 100)
    private String model;

    private Integer dimension;
}
