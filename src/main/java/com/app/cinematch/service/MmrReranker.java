package com.app.cinematch.service;

import com.app.cinematch.embedding.EmbeddingMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maximal Marginal Relevance: greedily picks rows that score high on relevance
 * while staying dissimilar to what has already been picked.
 * <pre>
 * mmr(i) = lambda * relevance[i] - (1 - lambda) * max_{s in selected} dot(i, s)
 * </pre>
 * lambda = 1 is a pure relevance sort; lambda = 0 only rewards novelty. Ties go
 * to the candidate that comes first in the input order.
 */
@Component
@Slf4j
public class MmrReranker {

    public List<Integer> rerank(int[] candidates, double[] relevance, EmbeddingMatrix matrix, int k, double lambda) {
        if (lambda < 0.0 || lambda > 1.0 || Double.isNaN(lambda)) {
            throw new IllegalArgumentException("lambda must be in [0, 1]: " + lambda);
        }
        if (k <= 0 || candidates.length == 0) {
            return List.of();
        }

        int limit = Math.min(k, candidates.length);
        List<Integer> selected = new ArrayList<>(limit);
        boolean[] taken = new boolean[candidates.length];
        // highest similarity of each candidate to any selected row so far
        double[] maxSimilarity = new double[candidates.length];
        Arrays.fill(maxSimilarity, Double.NEGATIVE_INFINITY);

        int first = 0;
        for (int j = 1; j < candidates.length; j++) {
            if (relevance[candidates[j]] > relevance[candidates[first]]) {
                first = j;
            }
        }
        taken[first] = true;
        selected.add(candidates[first]);

        while (selected.size() < limit) {
            int lastPicked = selected.get(selected.size() - 1);
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;

            for (int j = 0; j < candidates.length; j++) {
                if (taken[j]) {
                    continue;
                }
                double similarity = matrix.dot(candidates[j], lastPicked);
                if (similarity > maxSimilarity[j]) {
                    maxSimilarity[j] = similarity;
                }
                double score = lambda * relevance[candidates[j]] - (1.0 - lambda) * maxSimilarity[j];
                if (best < 0 || score > bestScore) {
                    best = j;
                    bestScore = score;
                }
            }

            taken[best] = true;
            selected.add(candidates[best]);
            log.debug("MMR pick {} -> row {} (score {})", selected.size(), candidates[best], bestScore);
        }

        return selected;
    }
}
