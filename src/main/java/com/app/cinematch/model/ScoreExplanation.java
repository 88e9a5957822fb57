package com.app.cinematch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weighted contribution of each signal to a recommendation's score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreExplanation {

    private double interest;
    private double discovery;
    private double collaborative;
    private double category;
    private double total;
}
