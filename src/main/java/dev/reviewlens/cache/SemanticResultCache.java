package dev.reviewlens.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answer cache keyed by question meaning rather than question text.
 *
 * <p>A lookup embeds the question and linearly scans every live entry, comparing embeddings by
 * cosine similarity. The best entry is a hit when its similarity reaches the configured threshold;
 * on equal similarity the first entry scanned wins. The scan is linear on purpose: expected cache
 * populations are in the hundreds to low thousands and the threshold precision matters more than
 * lookup structure.
 *
 * <p>Entries expire {@code ttl} after creation. Expiry is checked on read as well as delegated to
 * the store, so an entry past its TTL is never served even if the store has not evicted it yet.
 *
 * <p>Caching is an optimisation: a failing store or embedding model turns lookups into misses and
 * makes writes no-ops. Failures are logged and never reach the caller.
 */
@Service
public class SemanticResultCache {

  private static final Logger log = LoggerFactory.getLogger(SemanticResultCache.class);

  private final CacheStore cacheStore;
  private final EmbeddingModel embeddingModel;
  private final ObjectMapper objectMapper;
  private final CacheProperties properties;
  private final Clock clock;

  public SemanticResultCache(
      CacheStore cacheStore,
      EmbeddingModel embeddingModel,
      ObjectMapper objectMapper,
      CacheProperties properties,
      Clock clock) {
    this.cacheStore = cacheStore;
    this.embeddingModel = embeddingModel;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Finds a live entry whose question is semantically equivalent to the given one.
   *
   * @param question the incoming question
   * @return a hit with the best entry and its similarity, or a miss with the best similarity seen
   */
  public CacheLookup lookup(String question) {
    Embedding queryEmbedding;
    try {
      queryEmbedding = embeddingModel.embed(question).content();
    } catch (RuntimeException e) {
      log.error("Failed to embed question for cache lookup: {}", e.getMessage());
      return CacheLookup.miss(0.0, null);
    }

    try {
      Instant now = clock.instant();
      CacheEntry best = null;
      double bestSimilarity = 0.0;

      for (String key : cacheStore.scanKeys(properties.getKeyPrefix())) {
        CacheEntry entry = readEntry(key);
        if (entry == null || entry.isExpired(now, properties.getTtl())) {
          continue;
        }
        Double similarity = similarity(queryEmbedding, entry);
        if (similarity == null) {
          continue;
        }
        if (best == null || similarity > bestSimilarity) {
          best = entry;
          bestSimilarity = similarity;
        }
      }

      if (best != null && bestSimilarity >= properties.getSimilarityThreshold()) {
        log.info(
            "Cache HIT - similarity: {}, original: '{}', query: '{}'",
            String.format("%.4f", bestSimilarity),
            best.question(),
            question);
        return CacheLookup.hit(best, bestSimilarity, queryEmbedding);
      }

      log.debug(
          "Cache MISS - best similarity: {}, threshold: {}",
          String.format("%.4f", bestSimilarity),
          properties.getSimilarityThreshold());
      return CacheLookup.miss(bestSimilarity, queryEmbedding);
    } catch (RuntimeException e) {
      log.error("Cache lookup failed, treating as miss: {}", e.getMessage());
      return CacheLookup.miss(0.0, queryEmbedding);
    }
  }

  /**
   * Stores an answer for a question. The entry, including its embedding, is written as a single
   * value with the configured TTL. A later store for the same normalised question replaces it.
   *
   * @param question the question that was answered
   * @param answer the generated answer
   * @param contextCount number of reviews used as context
   */
  public void store(String question, String answer, int contextCount) {
    store(question, answer, contextCount, null);
  }

  /**
   * Stores an answer, reusing the question embedding computed by the preceding {@link #lookup}.
   *
   * @param question the question that was answered
   * @param answer the generated answer
   * @param contextCount number of reviews used as context
   * @param questionEmbedding the question's embedding, or null to compute it
   */
  public void store(
      String question,
      String answer,
      int contextCount,
      @Nullable Embedding questionEmbedding) {
    try {
      Embedding embedding =
          questionEmbedding != null
              ? questionEmbedding
              : embeddingModel.embed(question).content();
      String key = properties.getKeyPrefix() + QueryHasher.identifier(question);
      CacheEntry entry =
          new CacheEntry(key, question, embedding.vector(), answer, contextCount, clock.instant());
      cacheStore.put(key, objectMapper.writeValueAsString(entry), properties.getTtl());
      log.info("Added to cache: '{}' (key: {})", question, key);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialise cache entry for '{}': {}", question, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Failed to add '{}' to cache: {}", question, e.getMessage());
    }
  }

  /** Removes every entry. Safe to call on an empty or unreachable cache. */
  public void clear() {
    try {
      List<String> keys = cacheStore.scanKeys(properties.getKeyPrefix());
      if (keys.isEmpty()) {
        log.info("Cache was already empty");
        return;
      }
      for (String key : keys) {
        cacheStore.delete(key);
      }
      log.info("Cleared {} cache entries", keys.size());
    } catch (RuntimeException e) {
      log.error("Cache clear failed: {}", e.getMessage());
    }
  }

  /**
   * Summarises the live entries. Expired entries still present in the store are not counted.
   *
   * @return entry count and age bounds; an empty snapshot if the store is unreachable
   */
  public CacheStats stats() {
    try {
      Instant now = clock.instant();
      List<Instant> createdTimes = new ArrayList<>();
      for (String key : cacheStore.scanKeys(properties.getKeyPrefix())) {
        CacheEntry entry = readEntry(key);
        if (entry != null && !entry.isExpired(now, properties.getTtl())) {
          createdTimes.add(entry.createdAt());
        }
      }
      Optional<Instant> oldest = createdTimes.stream().min(Instant::compareTo);
      Optional<Instant> newest = createdTimes.stream().max(Instant::compareTo);
      return new CacheStats(
          createdTimes.size(),
          oldest.orElse(null),
          newest.orElse(null),
          properties.getSimilarityThreshold(),
          properties.getTtl());
    } catch (RuntimeException e) {
      log.error("Cache stats unavailable: {}", e.getMessage());
      return new CacheStats(
          0, null, null, properties.getSimilarityThreshold(), properties.getTtl());
    }
  }

  private @Nullable CacheEntry readEntry(String key) {
    Optional<String> raw = cacheStore.get(key);
    if (raw.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.readValue(raw.get(), CacheEntry.class);
    } catch (JsonProcessingException e) {
      log.warn("Skipping unreadable cache entry {}: {}", key, e.getOriginalMessage());
      return null;
    }
  }

  private @Nullable Double similarity(Embedding queryEmbedding, CacheEntry entry) {
    if (entry.embedding() == null || entry.embedding().length != queryEmbedding.dimension()) {
      log.debug("Skipping cache entry {} with incompatible embedding", entry.key());
      return null;
    }
    return CosineSimilarity.between(queryEmbedding, Embedding.from(entry.embedding()));
  }
}
