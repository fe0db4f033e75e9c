package dev.reviewlens.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached answer, stored as one serialized value together with the question embedding so that a
 * reader never observes one without the other.
 *
 * @param key content-derived store key
 * @param question the question as originally asked
 * @param embedding the question embedding used for similarity matching
 * @param answer the generated answer
 * @param contextCount number of reviews used as context for the answer
 * @param createdAt creation time
 */
public record CacheEntry(
    String key,
    String question,
    float[] embedding,
    String answer,
    int contextCount,
    Instant createdAt) {

  /**
   * An entry is expired once {@code createdAt + ttl} has been reached, whether or not the store
   * has evicted it yet.
   *
   * @param now current time
   * @param ttl configured time-to-live
   * @return true if the entry must no longer be served
   */
  public boolean isExpired(Instant now, Duration ttl) {
    return !now.isBefore(createdAt.plus(ttl));
  }
}
