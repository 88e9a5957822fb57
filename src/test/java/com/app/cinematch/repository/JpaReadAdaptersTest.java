package com.app.cinematch.repository;

import com.app.cinematch.embedding.EmbeddingMetadataIndexSource;
import com.app.cinematch.exception.DataUnavailableException;
import com.app.cinematch.model.EmbeddingMetadata;
import com.app.cinematch.model.Interaction;
import com.app.cinematch.model.InteractionAction;
import com.app.cinematch.model.InteractionRecord;
import com.app.cinematch.model.MovieMetadata;
import com.app.cinematch.service.JpaCatalogMetadata;
import com.app.cinematch.service.JpaInteractionReader;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.jdbc.Sql;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the read adapters against tables created from a script shaped like the
 * catalog application's schema; Hibernate never generates DDL here.
 */
@DataJpaTest(properties = {
        "spring.jpa.hibernate.ddl-auto=none",
        "spring.jpa.properties.hibernate.globally_quoted_identifiers=true",
        "spring.sql.init.schema-locations=classpath:db/application-schema.sql"
})
@Import({JpaInteractionReader.class, JpaCatalogMetadata.class})
class JpaReadAdaptersTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JpaInteractionReader interactionReader;

    @Autowired
    private JpaCatalogMetadata catalogMetadata;

    @Autowired
    private MovieMetadataRepository movieMetadataRepository;

    @Autowired
    private EmbeddingMetadataRepository embeddingMetadataRepository;

    private void interaction(long userId, long movieId, InteractionAction action, Double rating, LocalDateTime at) {
        entityManager.persist(Interaction.builder()
                .userId(userId)
                .movieId(movieId)
                .action(action)
                .rating(rating)
                .timestamp(at)
                .build());
    }

    @Test
    void readsOneUsersInteractionsInInsertOrder() {
        interaction(7, 100, InteractionAction.WATCH, null, LocalDateTime.of(2024, 3, 1, 10, 0));
        interaction(8, 100, InteractionAction.SKIP, null, LocalDateTime.of(2024, 3, 1, 11, 0));
        interaction(7, 100, InteractionAction.RATE, 8.5, LocalDateTime.of(2024, 3, 2, 9, 30));
        interaction(7, 200, InteractionAction.WATCHLIST, null, null);
        entityManager.flush();
        entityManager.clear();

        List<InteractionRecord> records = interactionReader.get(7);

        assertThat(records).extracting(InteractionRecord::getAction)
                .containsExactly(InteractionAction.WATCH, InteractionAction.RATE, InteractionAction.WATCHLIST);
        assertThat(records.get(0).getTimestamp()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(records.get(1).getRating()).isEqualTo(8.5);
        assertThat(records.get(2).getTimestamp()).isNull();
        assertThat(interactionReader.get(9)).isEmpty();
    }

    @Test
    @Sql("/db/catalog-data.sql")
    void popularityComesFromMoviesTable() {
        assertThat(catalogMetadata.popularity(3)).isEqualTo(55.0);
        assertThat(catalogMetadata.popularity(4)).isEqualTo(0.0);
        assertThat(catalogMetadata.popularity(404)).isEqualTo(0.0);

        assertThat(catalogMetadata.mostPopular(3)).containsExactly(2L, 1L, 3L);
        assertThat(catalogMetadata.mostPopular(10)).doesNotContain(4L);
        assertThat(catalogMetadata.mostPopular(0)).isEmpty();
    }

    @Test
    @Sql("/db/catalog-data.sql")
    void genresComeFromMovieMetadataJson() {
        assertThat(movieMetadataRepository.findById(1L))
                .get()
                .extracting(MovieMetadata::getGenres)
                .isEqualTo(List.of("Drama", "Thriller"));
        assertThat(movieMetadataRepository.findById(4L).orElseThrow().getGenreSet()).isEmpty();

        assertThat(catalogMetadata.genres(1)).containsExactly("Drama", "Thriller");
        assertThat(catalogMetadata.genres(3)).containsExactly("Comedy");
        assertThat(catalogMetadata.genres(2)).isEmpty();
        assertThat(catalogMetadata.genres(404)).isEmpty();
    }

    @Test
    void indexComesFromEmbeddingMetadata() {
        entityManager.persist(EmbeddingMetadata.builder().movieId(10L).title("A").embeddingIndex(1).build());
        entityManager.persist(EmbeddingMetadata.builder().movieId(20L).title("B").embeddingIndex(0).build());
        entityManager.flush();

        Map<Long, Integer> index = new EmbeddingMetadataIndexSource(embeddingMetadataRepository).load();

        assertThat(index).containsExactlyInAnyOrderEntriesOf(Map.of(10L, 1, 20L, 0));
    }

    @Test
    void emptyEmbeddingMetadataIsUnavailable() {
        EmbeddingMetadataIndexSource source = new EmbeddingMetadataIndexSource(embeddingMetadataRepository);

        assertThatThrownBy(source::load)
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("No embedding metadata");
    }
}
