package com.app.cinematch.monitoring;

import com.app.cinematch.service.WeightTier;
import io.micrometer.core.instrument.*;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;


@Service
@Slf4j
public class RecommendationMetrics {

    private final Tracer recommendationTracer;
    private final Tracer similarityTracer;

    // Counters
    private final Counter recommendationRequests;
    private final Counter successfulRecommendations;
    private final Counter failedRecommendations;
    private final Counter coldStarts;
    private final Counter similarityLookups;
    private final Counter notEmbeddedLookups;

    // Timers
    private final io.micrometer.core.instrument.Timer recommendationLatency;
    private final io.micrometer.core.instrument.Timer similarityLatency;

    // Gauges
    private final AtomicInteger activeRequests = new AtomicInteger(0);
    private final AtomicInteger cachedVectors = new AtomicInteger(0);

    // Distribution summaries
    private final DistributionSummary candidateCount;
    private final DistributionSummary watchedCount;

    public RecommendationMetrics(MeterRegistry meterRegistry) {
        // Tracer provider is local to this bean; no exporter is registered globally
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder().build();
        this.recommendationTracer = tracerProvider.get("cinematch.recommendation");
        this.similarityTracer = tracerProvider.get("cinematch.similarity");

        // Initialize counters
        this.recommendationRequests = Counter.builder("recommendation.requests.total")
                .description("Total recommendation requests")
                .register(meterRegistry);

        this.successfulRecommendations = Counter.builder("recommendation.success.total")
                .description("Successful recommendation requests")
                .register(meterRegistry);

        this.failedRecommendations = Counter.builder("recommendation.failures.total")
                .description("Failed recommendation requests")
                .register(meterRegistry);

        this.coldStarts = Counter.builder("recommendation.cold.start.total")
                .description("Requests served from the popularity fallback")
                .register(meterRegistry);

        this.similarityLookups = Counter.builder("similarity.lookups.total")
                .description("Similar-movie lookups")
                .register(meterRegistry);

        this.notEmbeddedLookups = Counter.builder("similarity.not.embedded.total")
                .description("Similar-movie lookups for movies without an embedding")
                .register(meterRegistry);

        // Initialize timers
        this.recommendationLatency = io.micrometer.core.instrument.Timer.builder("recommendation.latency")
                .description("Total recommendation request latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.similarityLatency = io.micrometer.core.instrument.Timer.builder("similarity.latency")
                .description("Similar-movie lookup latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        // Initialize gauges
        Gauge.builder("recommendation.active.requests", activeRequests::get)
                .description("Active recommendation requests")
                .register(meterRegistry);

        Gauge.builder("recommendation.cached.vectors", cachedVectors::get)
                .description("Embedding rows held in memory")
                .register(meterRegistry);

        // Initialize distribution summaries
        this.candidateCount = DistributionSummary.builder("recommendation.candidates.count")
                .description("Candidate rows entering MMR re-ranking")
                .baseUnit("movies")
                .register(meterRegistry);

        this.watchedCount = DistributionSummary.builder("recommendation.history.watched")
                .description("Watched movies per personalized request")
                .baseUnit("movies")
                .register(meterRegistry);
    }

    /**
     * Record recommendation request start
     */
    public RecommendationTraceContext startRecommendationRequest(long userId, int k, double lambda) {
        recommendationRequests.increment();
        activeRequests.incrementAndGet();

        Span span = recommendationTracer.spanBuilder("recommendation.request")
                .setAttribute("user.id", userId)
                .setAttribute("k", k)
                .setAttribute("lambda", lambda)
                .startSpan();

        log.info("Recommendation request started - User: {}, k: {}, lambda: {}", userId, k, lambda);

        return new RecommendationTraceContext(span, System.currentTimeMillis());
    }

    /**
     * Record that the popularity fallback served the request
     */
    public void recordColdStart(RecommendationTraceContext context) {
        coldStarts.increment();
        context.span.setAttribute("cold.start", true);
        log.info("No watch or skip history, serving popular movies");
    }

    /**
     * Record the personalized scoring stage
     */
    public void recordScoring(RecommendationTraceContext context, WeightTier tier, int watched, int candidates) {
        watchedCount.record(watched);
        candidateCount.record(candidates);

        context.span.setAttribute("weight.tier", tier.name());
        context.span.setAttribute("candidates", candidates);

        log.debug("Scoring completed - Tier: {}, Watched: {}, Candidates: {}", tier, watched, candidates);
    }

    /**
     * Record the number of embedding rows currently loaded
     */
    public void recordEmbeddingsLoaded(int rows) {
        cachedVectors.set(rows);
    }

    /**
     * Record successful recommendation response
     */
    public void recordSuccess(RecommendationTraceContext context, int recommendationsReturned) {
        successfulRecommendations.increment();
        activeRequests.decrementAndGet();

        long totalLatency = System.currentTimeMillis() - context.startTime;
        recommendationLatency.record(totalLatency, TimeUnit.MILLISECONDS);

        context.span.setAttribute("recommendations.returned", recommendationsReturned);
        context.span.setAttribute("total.latency.ms", totalLatency);

        log.info("Recommendation request completed successfully - Recommendations: {}, Latency: {}ms",
                recommendationsReturned, totalLatency);

        context.span.end();
    }

    /**
     * Record failed recommendation
     */
    public void recordFailure(RecommendationTraceContext context, Exception error) {
        failedRecommendations.increment();
        activeRequests.decrementAndGet();

        context.span.recordException(error);
        context.span.setAttribute("error", true);
        context.span.setAttribute("error.message", String.valueOf(error.getMessage()));

        log.error("Recommendation request failed", error);

        context.span.end();
    }

    /**
     * Record a similar-movie lookup
     */
    public void recordSimilarityLookup(long movieId, boolean embedded, int results, long latencyMs) {
        similarityLookups.increment();
        if (!embedded) {
            notEmbeddedLookups.increment();
        }
        similarityLatency.record(latencyMs, TimeUnit.MILLISECONDS);

        Span span = similarityTracer.spanBuilder("similarity.lookup")
                .setAttribute("movie.id", movieId)
                .setAttribute("embedded", embedded)
                .setAttribute("results", results)
                .setAttribute("latency.ms", latencyMs)
                .startSpan();

        log.debug("Similarity lookup for movie {} - Embedded: {}, Results: {} ({}ms)",
                movieId, embedded, results, latencyMs);

        span.end();
    }

    /**
     * Trace context holder
     */
    public static class RecommendationTraceContext {
        public final Span span;
        public final long startTime;

        public RecommendationTraceContext(Span span, long startTime) {
            this.span = span;
            this.startTime = startTime;
        }
    }
}
