package com.app.cinematch.scheduler;

import com.app.cinematch.embedding.EmbeddingSnapshot;
import com.app.cinematch.embedding.EmbeddingStore;
import com.app.cinematch.exception.RecommendationEngineException;
import com.app.cinematch.monitoring.RecommendationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads the embeddings shortly after startup so the first request does not pay
 * for it. A failure here is not fatal: the store retries on the next request.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingWarmupScheduler {

    private final EmbeddingStore embeddingStore;
    private final RecommendationMetrics metrics;

    @Scheduled(initialDelayString = "${cinematch.embeddings.warmup-delay-ms:30000}", fixedDelay = Long.MAX_VALUE)
    public void warmUp() {
        if (embeddingStore.isLoaded()) {
            return;
        }
        log.info("Warming up embedding store");

        try {
            long startTime = System.currentTimeMillis();
            EmbeddingSnapshot snapshot = embeddingStore.load();
            metrics.recordEmbeddingsLoaded(snapshot.rows());
            log.info("Embedding warm-up complete in {}ms ({} rows)",
                    System.currentTimeMillis() - startTime, snapshot.rows());
        } catch (RecommendationEngineException e) {
            log.warn("Embedding warm-up failed (non-blocking): {}", e.getMessage());
        }
    }
}
