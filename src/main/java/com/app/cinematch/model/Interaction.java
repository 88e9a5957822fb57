package com.app.cinematch.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "interactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Interaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "movie_id", nullable = false)
    private Long movieId;

    @Column(nullable = false, length = 20)
    private InteractionAction action;

    // 0-10 scale, only set for rate actions
    private Double rating;

    /**
     * UTC wall-clock time of the interaction.
     */
    @Column(name = "timestamp")
    private LocalDateTime timestamp;

    @Column(name = "watch_duration_minutes")
    private Integer watchDurationMinutes;
}
