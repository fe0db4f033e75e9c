package dev.reviewlens.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import dev.reviewlens.ingestion.ReviewIndexer;
import dev.reviewlens.review.AttributePredicate;
import dev.reviewlens.review.ReviewAttribute;
import dev.reviewlens.review.ReviewStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Hybrid retrieval against a real pgvector index, including metadata-filtered searches. */
@SpringBootTest(
    properties = {
      "reviewlens.vector-index.type=pgvector",
      "reviewlens.search.strategy-multiplier=1",
      "reviewlens.index.on-startup=true"
    })
@ActiveProfiles("test")
@Testcontainers
class PgVectorRetrievalIT {

  @Container
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  @DynamicPropertySource
  static void pgvectorProperties(DynamicPropertyRegistry registry) {
    registry.add("reviewlens.vector-index.pgvector.host", postgres::getHost);
    registry.add("reviewlens.vector-index.pgvector.port", () -> postgres.getMappedPort(5432));
    registry.add("reviewlens.vector-index.pgvector.database", postgres::getDatabaseName);
    registry.add("reviewlens.vector-index.pgvector.user", postgres::getUsername);
    registry.add("reviewlens.vector-index.pgvector.password", postgres::getPassword);
  }

  @Autowired EmbeddingStore<TextSegment> embeddingStore;

  @Autowired EmbeddingModel embeddingModel;

  @Autowired ReviewStore reviewStore;

  @Autowired ReviewIndexer reviewIndexer;

  @Autowired HybridRetrievalService retrievalService;

  @BeforeEach
  void reindex() {
    embeddingStore.removeAll();
    reviewIndexer.index(reviewStore.all());
  }

  @Test
  void pgvector_store_is_selected() {
    assertThat(embeddingStore).isInstanceOf(PgVectorEmbeddingStore.class);
  }

  @Test
  void reindexing_upserts_instead_of_duplicating() {
    reviewIndexer.index(reviewStore.all());

    List<EmbeddingMatch<TextSegment>> matches =
        embeddingStore
            .search(
                EmbeddingSearchRequest.builder()
                    .queryEmbedding(embeddingModel.embed("park").content())
                    .maxResults(100)
                    .build())
            .matches();

    assertThat(matches).hasSize(reviewStore.size());
  }

  @Test
  void id_restricted_search_stays_within_candidates() {
    RetrievalResult result =
        retrievalService.retrieve(
            new RetrievalRequest(
                "nice food near the castle",
                List.of(AttributePredicate.contains(ReviewAttribute.BRANCH, "Paris")),
                1));

    assertThat(result.strategy()).isEqualTo(RetrievalStrategy.ID_RESTRICTED);
    assertThat(result.results())
        .singleElement()
        .satisfies(r -> assertThat(r.review().branch()).isEqualTo("Disneyland_Paris"));
  }
}
