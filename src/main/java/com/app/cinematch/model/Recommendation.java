package com.app.cinematch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private long movieId;
    private double score;
    private ScoreExplanation explanation;
}
