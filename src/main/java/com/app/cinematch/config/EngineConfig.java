package com.app.cinematch.config;

import com.app.cinematch.embedding.EmbeddingMetadataIndexSource;
import com.app.cinematch.embedding.EmbeddingSource;
import com.app.cinematch.embedding.EmbeddingStore;
import com.app.cinematch.embedding.IndexSource;
import com.app.cinematch.embedding.JsonIndexSource;
import com.app.cinematch.embedding.NpyEmbeddingSource;
import com.app.cinematch.repository.EmbeddingMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the embedding store to its sources. The matrix always comes from a
 * {@code .npy} file; the index comes from the database unless
 * {@code cinematch.embeddings.index-source=file}.
 */
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EmbeddingSource embeddingSource(
            @Value("${cinematch.embeddings.path:data/embeddings.npy}") String embeddingsPath) {
        return new NpyEmbeddingSource(Path.of(embeddingsPath));
    }

    @Bean
    @ConditionalOnProperty(name = "cinematch.embeddings.index-source", havingValue = "database", matchIfMissing = true)
    public IndexSource databaseIndexSource(EmbeddingMetadataRepository embeddingMetadataRepository) {
        return new EmbeddingMetadataIndexSource(embeddingMetadataRepository);
    }

    @Bean
    @ConditionalOnProperty(name = "cinematch.embeddings.index-source", havingValue = "file")
    public IndexSource fileIndexSource(
            @Value("${cinematch.embeddings.index-path:data/embedding_index.json}") String indexPath) {
        return new JsonIndexSource(Path.of(indexPath), new ObjectMapper());
    }

    @Bean
    public EmbeddingStore embeddingStore(EmbeddingSource embeddingSource, IndexSource indexSource) {
        return new EmbeddingStore(embeddingSource, indexSource);
    }
}
