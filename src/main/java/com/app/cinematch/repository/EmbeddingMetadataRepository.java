package com.app.cinematch.repository;

import com.app.cinematch.model.EmbeddingMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EmbeddingMetadataRepository extends JpaRepository<EmbeddingMetadata, Long> {
}
