package com.app.cinematch.embedding;

import com.app.cinematch.exception.DataUnavailableException;
import com.app.cinematch.exception.InconsistentDataException;
import com.app.cinematch.model.EmbeddingMetadata;
import com.app.cinematch.repository.EmbeddingMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the index from the {@code embedding_metadata} table written by the
 * offline embedding job.
 */
@Slf4j
@RequiredArgsConstructor
public class EmbeddingMetadataIndexSource implements IndexSource {

    private final EmbeddingMetadataRepository embeddingMetadataRepository;

    @Override
    public Map<Long, Integer> load() {
        List<EmbeddingMetadata> metadata;
        try {
            metadata = embeddingMetadataRepository.findAll();
        } catch (DataAccessException e) {
            throw new DataUnavailableException("Failed to read embedding metadata", e);
        }

        if (metadata.isEmpty()) {
            throw new DataUnavailableException(
                    "No embedding metadata found. Run the embedding generation job first.");
        }

        Map<Long, Integer> index = new HashMap<>(metadata.size());
        for (EmbeddingMetadata meta : metadata) {
            Integer previous = index.put(meta.getMovieId(), meta.getEmbeddingIndex());
            if (previous != null) {
                throw new InconsistentDataException("Movie " + meta.getMovieId() + " has more than one embedding row");
            }
        }
        log.info("Read {} embedding metadata rows", index.size());
        return index;
    }
}
