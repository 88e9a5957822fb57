package com.app.cinematch.repository;

import com.app.cinematch.model.Movie;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MovieRepository extends JpaRepository<Movie, Long> {

    List<Movie> findByPopularityIsNotNullOrderByPopularityDescIdAsc(Pageable pageable);
}
