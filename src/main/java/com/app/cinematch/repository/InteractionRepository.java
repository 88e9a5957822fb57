package com.app.cinematch.repository;

import com.app.cinematch.model.Interaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, Long> {

    List<Interaction> findByUserIdOrderByIdAsc(Long userId);
}
