package com.app.cinematch.service;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.embedding.EmbeddingStore;
import com.app.cinematch.model.InteractionRecord;
import com.app.cinematch.model.Recommendation;
import com.app.cinematch.model.ScoreExplanation;
import com.app.cinematch.model.UserHistory;
import com.app.cinematch.monitoring.RecommendationMetrics;
import com.app.cinematch.signal.Signal;
import com.app.cinematch.signal.SignalComputer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@Slf4j
public class RecommendationService {

    private final EmbeddingStore embeddingStore;
    private final InteractionReader interactionReader;
    private final CatalogMetadata catalogMetadata;
    private final Map<Signal, SignalComputer> signalComputers;
    private final ScoreFusion scoreFusion;
    private final MmrReranker mmrReranker;
    private final RecommendationMetrics metrics;

    private final int defaultCount;
    private final int maxCount;
    private final double defaultLambda;

    public RecommendationService(
            EmbeddingStore embeddingStore,
            InteractionReader interactionReader,
            CatalogMetadata catalogMetadata,
            List<SignalComputer> signalComputers,
            ScoreFusion scoreFusion,
            MmrReranker mmrReranker,
            RecommendationMetrics metrics,
            @Value("${cinematch.recommendation.default-count:10}") int defaultCount,
            @Value("${cinematch.recommendation.max-count:20}") int maxCount,
            @Value("${cinematch.recommendation.default-lambda:0.7}") double defaultLambda) {
        this.embeddingStore = embeddingStore;
        this.interactionReader = interactionReader;
        this.catalogMetadata = catalogMetadata;
        this.signalComputers = indexBySignal(signalComputers);
        this.scoreFusion = scoreFusion;
        this.mmrReranker = mmrReranker;
        this.metrics = metrics;
        this.defaultCount = defaultCount;
        this.maxCount = maxCount;
        this.defaultLambda = defaultLambda;
    }

    /**
     * Recommendations with the configured count and diversity.
     */
    public List<Recommendation> getRecommendations(long userId) {
        return getRecommendations(userId, Math.min(defaultCount, maxCount), defaultLambda);
    }

    /**
     * Ranked, diversified recommendations for a user.
     *
     * @param userId the user to recommend for
     * @param k      maximum number of recommendations
     * @param lambda relevance/diversity trade-off in [0, 1]; 1 ranks by relevance only
     * @return at most {@code k} recommendations, best first
     */
    public List<Recommendation> getRecommendations(long userId, int k, double lambda) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        if (!(lambda >= 0.0 && lambda <= 1.0)) {
            throw new IllegalArgumentException("lambda must be in [0, 1]: " + lambda);
        }

        RecommendationMetrics.RecommendationTraceContext context = metrics.startRecommendationRequest(userId, k, lambda);

        try {
            EmbeddingSnapshot snapshot = embeddingStore.load();
            metrics.recordEmbeddingsLoaded(snapshot.rows());

            List<InteractionRecord> records = interactionReader.get(userId);
            UserHistory history = UserHistory.from(records);

            List<Recommendation> recommendations;
            if (history.isColdStart()) {
                metrics.recordColdStart(context);
                recommendations = popularFallback(k);
            } else {
                recommendations = personalize(history, snapshot, k, lambda, context);
            }

            metrics.recordSuccess(context, recommendations.size());
            return recommendations;

        } catch (RuntimeException e) {
            log.error("Error processing recommendation request for user {}", userId, e);
            metrics.recordFailure(context, e);
            throw e;
        }
    }

    private List<Recommendation> popularFallback(int k) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (Long movieId : catalogMetadata.mostPopular(k)) {
            double popularity = catalogMetadata.popularity(movieId);
            recommendations.add(Recommendation.builder()
                    .movieId(movieId)
                    .score(popularity)
                    .explanation(ScoreExplanation.builder()
                            .total(popularity)
                            .build())
                    .build());
        }
        return recommendations;
    }

    private List<Recommendation> personalize(UserHistory history, EmbeddingSnapshot snapshot, int k, double lambda,
            RecommendationMetrics.RecommendationTraceContext context) {

        // Step 1: Score the whole catalog with every signal
        Map<Signal, double[]> vectors = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            vectors.put(signal, signalComputers.get(signal).compute(history, snapshot));
        }

        // Step 2: Blend with weights chosen by history size
        WeightTier tier = WeightTier.forWatchCount(history.watchCount());
        double[] combined = scoreFusion.fuse(vectors, tier, snapshot.rows());

        // Step 3: Drop watched movies, then diversify
        int[] candidates = scoreFusion.candidateRows(snapshot.getMapping(), history.watchedMovieIds());
        metrics.recordScoring(context, tier, history.watchCount(), candidates.length);

        List<Integer> selected = mmrReranker.rerank(candidates, combined, snapshot.getMatrix(), k, lambda);

        // Step 4: Explain each pick
        List<Recommendation> recommendations = new ArrayList<>(selected.size());
        for (int row : selected) {
            Optional<Long> movieId = snapshot.getMapping().movieAt(row);
            if (movieId.isEmpty()) {
                continue;
            }
            recommendations.add(Recommendation.builder()
                    .movieId(movieId.get())
                    .score(combined[row])
                    .explanation(ScoreExplanation.builder()
                            .interest(tier.weight(Signal.INTEREST) * vectors.get(Signal.INTEREST)[row])
                            .discovery(tier.weight(Signal.DISCOVERY) * vectors.get(Signal.DISCOVERY)[row])
                            .collaborative(tier.weight(Signal.COLLABORATIVE) * vectors.get(Signal.COLLABORATIVE)[row])
                            .category(tier.weight(Signal.CATEGORY) * vectors.get(Signal.CATEGORY)[row])
                            .total(combined[row])
                            .build())
                    .build());
        }
        return recommendations;
    }

    private static Map<Signal, SignalComputer> indexBySignal(List<SignalComputer> computers) {
        Map<Signal, SignalComputer> bySignal = new EnumMap<>(Signal.class);
        for (SignalComputer computer : computers) {
            if (bySignal.put(computer.signal(), computer) != null) {
                throw new IllegalStateException("More than one computer for signal " + computer.signal());
            }
        }
        for (Signal signal : Signal.values()) {
            if (!bySignal.containsKey(signal)) {
                throw new IllegalStateException("No computer registered for signal " + signal);
            }
        }
        return bySignal;
    }
}
