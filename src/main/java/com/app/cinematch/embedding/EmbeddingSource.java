package com.app.cinematch.embedding;

/**
 * Supplies the embedding matrix. Row order must agree with the {@link IndexSource}.
 */
@FunctionalInterface
public interface EmbeddingSource {

    EmbeddingMatrix load();
}
