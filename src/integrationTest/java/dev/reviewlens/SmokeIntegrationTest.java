package dev.reviewlens;

import static org.assertj.core.api.Assertions.assertThat;

import dev.reviewlens.answer.ReviewQuestionService;
import dev.reviewlens.cache.CacheStore;
import dev.reviewlens.cache.InMemoryCacheStore;
import dev.reviewlens.review.ReviewStore;
import dev.reviewlens.search.HybridRetrievalService;
import dev.reviewlens.search.RetrievalRequest;
import dev.reviewlens.search.RetrievalResult;
import dev.reviewlens.search.RetrievalStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Boots the full context on the default in-memory vector index and cache store, indexing the test
 * corpus with the real embedding model.
 */
@SpringBootTest(properties = "reviewlens.index.on-startup=true")
@ActiveProfiles("test")
class SmokeIntegrationTest {

  @Autowired ReviewStore reviewStore;

  @Autowired CacheStore cacheStore;

  @Autowired HybridRetrievalService retrievalService;

  @Autowired ReviewQuestionService questionService;

  @Test
  void context_loads_with_in_memory_defaults() {
    assertThat(reviewStore.size()).isEqualTo(3);
    assertThat(cacheStore).isInstanceOf(InMemoryCacheStore.class);
    assertThat(questionService).isNotNull();
  }

  @Test
  void retrieval_uses_indexed_reviews() {
    RetrievalResult result =
        retrievalService.retrieve(new RetrievalRequest("friendly staff", 3));

    assertThat(result.strategy()).isEqualTo(RetrievalStrategy.FULL_SEARCH);
    assertThat(result.results()).isNotEmpty();
    assertThat(result.results().get(0).review().id()).isEqualTo("1");
    assertThat(result.results().get(0).vectorScore()).isGreaterThan(0.0);
  }
}
