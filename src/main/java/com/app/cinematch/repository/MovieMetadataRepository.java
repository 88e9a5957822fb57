package com.app.cinematch.repository;

import com.app.cinematch.model.MovieMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MovieMetadataRepository extends JpaRepository<MovieMetadata, Long> {
}
