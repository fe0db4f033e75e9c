package dev.reviewlens.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process {@link CacheStore}.
 *
 * <p>Expiry is lazy: an expired value stays in the map until a read or scan observes it, at which
 * point it is removed. Time comes from the injected {@link Clock}, which lets tests move past a TTL
 * without sleeping.
 */
public class InMemoryCacheStore implements CacheStore {

  private final ConcurrentHashMap<String, StoredValue> values = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCacheStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
    }
    values.put(key, new StoredValue(value, clock.instant().plus(ttl)));
  }

  @Override
  public Optional<String> get(String key) {
    StoredValue stored = values.get(key);
    if (stored == null) {
      return Optional.empty();
    }
    if (stored.isExpired(clock.instant())) {
      values.remove(key, stored);
      return Optional.empty();
    }
    return Optional.of(stored.value());
  }

  @Override
  public void delete(String key) {
    values.remove(key);
  }

  @Override
  public List<String> scanKeys(String prefix) {
    Instant now = clock.instant();
    List<String> keys = new ArrayList<>();
    for (Map.Entry<String, StoredValue> entry : values.entrySet()) {
      if (!entry.getKey().startsWith(prefix)) {
        continue;
      }
      if (entry.getValue().isExpired(now)) {
        values.remove(entry.getKey(), entry.getValue());
      } else {
        keys.add(entry.getKey());
      }
    }
    return keys;
  }

  private record StoredValue(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
