package com.app.cinematch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One user interaction as seen by the engine. Read-only snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionRecord {

    private long userId;
    private long movieId;
    private InteractionAction action;
    private Double rating;
    private Instant timestamp;
}
