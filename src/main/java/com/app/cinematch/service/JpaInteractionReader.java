package com.app.cinematch.service;

import com.app.cinematch.model.Interaction;
import com.app.cinematch.model.InteractionRecord;
import com.app.cinematch.repository.InteractionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaInteractionReader implements InteractionReader {

    private final InteractionRepository interactionRepository;

    @Override
    @Transactional(readOnly = true)
    public List<InteractionRecord> get(long userId) {
        List<Interaction> interactions = interactionRepository.findByUserIdOrderByIdAsc(userId);
        log.debug("Read {} interactions for user {}", interactions.size(), userId);

        return interactions.stream()
                .map(this::toRecord)
                .collect(Collectors.toList());
    }

    private InteractionRecord toRecord(Interaction interaction) {
        return InteractionRecord.builder()
                .userId(interaction.getUserId())
                .movieId(interaction.getMovieId())
                .action(interaction.getAction())
                .rating(interaction.getRating())
                .timestamp(interaction.getTimestamp() != null
                        ? interaction.getTimestamp().toInstant(ZoneOffset.UTC)
                        : null)
                .build();
    }
}
