package dev.reviewlens.ingestion;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.reviewlens.review.Review;
import dev.reviewlens.review.ReviewSegments;
import dev.reviewlens.review.ReviewStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Embeds the review corpus into the vector index at startup.
 *
 * <p>Reviews are embedded in batches and written with deterministic ids derived from the review id,
 * so a persistent index is upserted rather than duplicated across restarts. Indexing is
 * best-effort: a failed batch is logged and the remaining batches still run. Reviews missing from
 * the index are still reachable through lexical scoring.
 *
 * <p>Disabled with {@code reviewlens.index.on-startup=false}, e.g. when a pgvector index is
 * populated out of band.
 */
@Component
@ConditionalOnProperty(
    name = "reviewlens.index.on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class ReviewIndexer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ReviewIndexer.class);

  static final int EMBED_BATCH_SIZE = 256;

  private final ReviewStore reviewStore;
  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;

  public ReviewIndexer(
      ReviewStore reviewStore,
      EmbeddingModel embeddingModel,
      EmbeddingStore<TextSegment> embeddingStore) {
    this.reviewStore = reviewStore;
    this.embeddingModel = embeddingModel;
    this.embeddingStore = embeddingStore;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("Indexing {} reviews into the vector index", reviewStore.size());
    int indexed = index(reviewStore.all());
    log.info("Indexed {}/{} reviews", indexed, reviewStore.size());
  }

  /**
   * Embeds and stores the given reviews.
   *
   * @param reviews reviews to index
   * @return number of reviews successfully written
   */
  public int index(List<Review> reviews) {
    int indexed = 0;
    for (int i = 0; i < reviews.size(); i += EMBED_BATCH_SIZE) {
      List<Review> batch = reviews.subList(i, Math.min(i + EMBED_BATCH_SIZE, reviews.size()));
      try {
        storeBatch(batch);
        indexed += batch.size();
      } catch (RuntimeException e) {
        log.error(
            "Failed to index reviews {}-{}: {}", i, i + batch.size() - 1, e.getMessage());
      }
    }
    return indexed;
  }

  private void storeBatch(List<Review> batch) {
    List<TextSegment> segments = batch.stream().map(ReviewSegments::toTextSegment).toList();
    List<String> ids = batch.stream().map(ReviewSegments::embeddingId).toList();
    List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
    embeddingStore.addAll(ids, embeddings, segments);
  }
}
