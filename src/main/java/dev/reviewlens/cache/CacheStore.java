package dev.reviewlens.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value store with per-key expiration backing the {@link SemanticResultCache}.
 *
 * <p>Each operation is atomic per key; no multi-key transactions are assumed. Implementations
 * report infrastructure failures as {@link CacheStoreException}.
 */
public interface CacheStore {

  /**
   * Writes a value that expires after {@code ttl}. Overwrites any existing value.
   *
   * @param key the key
   * @param value the serialized value
   * @param ttl time-to-live, must be positive
   */
  void put(String key, String value, Duration ttl);

  /**
   * Reads a live value.
   *
   * @param key the key
   * @return the value, or empty if absent or expired
   */
  Optional<String> get(String key);

  /**
   * Removes a key. Removing an absent key is a no-op.
   *
   * @param key the key
   */
  void delete(String key);

  /**
   * Lists live keys starting with the given prefix. The listing is not a snapshot: keys written or
   * expiring concurrently may or may not be included.
   *
   * @param prefix key prefix
   * @return matching keys in no particular order
   */
  List<String> scanKeys(String prefix);
}
