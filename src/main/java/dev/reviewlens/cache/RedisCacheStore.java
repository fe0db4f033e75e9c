package dev.reviewlens.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed {@link CacheStore}.
 *
 * <p>Values are written with a single {@code SET key value EX ttl}, so a value and its expiry are
 * applied atomically and expiry is enforced by Redis itself. Key listing uses incremental {@code
 * SCAN ... MATCH prefix*} rather than {@code KEYS} to avoid blocking the server.
 */
public class RedisCacheStore implements CacheStore {

  /** Hint for the number of keys Redis inspects per SCAN step. */
  private static final long SCAN_COUNT = 500;

  private final StringRedisTemplate redisTemplate;

  public RedisCacheStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
    } catch (DataAccessException e) {
      throw new CacheStoreException("Redis SET failed for " + key, e);
    }
  }

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException e) {
      throw new CacheStoreException("Redis GET failed for " + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      redisTemplate.delete(key);
    } catch (DataAccessException e) {
      throw new CacheStoreException("Redis DEL failed for " + key, e);
    }
  }

  @Override
  public List<String> scanKeys(String prefix) {
    ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_COUNT).build();
    List<String> keys = new ArrayList<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      cursor.forEachRemaining(keys::add);
    } catch (DataAccessException e) {
      throw new CacheStoreException("Redis SCAN failed for prefix " + prefix, e);
    }
    return keys;
  }
}
