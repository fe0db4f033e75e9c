package dev.reviewlens.cache;

import dev.langchain4j.data.embedding.Embedding;
import org.jspecify.annotations.Nullable;

/**
 * Result of a semantic cache lookup.
 *
 * @param entry the matched entry on a hit, null on a miss
 * @param similarity cosine similarity of the best live entry (0.0 if the cache was empty or
 *     unreachable)
 * @param questionEmbedding embedding of the looked-up question, null if it could not be computed;
 *     pass it back to {@link SemanticResultCache#store(String, String, int, Embedding)} after a miss
 */
public record CacheLookup(
    @Nullable CacheEntry entry, double similarity, @Nullable Embedding questionEmbedding) {

  static CacheLookup hit(CacheEntry entry, double similarity, Embedding questionEmbedding) {
    return new CacheLookup(entry, similarity, questionEmbedding);
  }

  static CacheLookup miss(double bestSimilarity, @Nullable Embedding questionEmbedding) {
    return new CacheLookup(null, bestSimilarity, questionEmbedding);
  }

  public boolean isHit() {
    return entry != null;
  }
}
