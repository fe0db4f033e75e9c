package dev.reviewlens.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the semantic result cache.
 *
 * <p>Properties are bound from {@code reviewlens.cache.*} in application.yml.
 *
 * <ul>
 *   <li>{@code similarity-threshold} - minimum cosine similarity for a hit (default 0.95, in (0,
 *       1])
 *   <li>{@code ttl} - lifetime of an entry (default 24h)
 *   <li>{@code key-prefix} - namespace for cache keys in the store (default {@code
 *       reviewlens:cache:})
 *   <li>{@code store} - {@code in-memory} (default) or {@code redis}, read by {@link
 *       CacheStoreConfig}
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "reviewlens.cache")
public class CacheProperties {

  private double similarityThreshold = 0.95;
  private Duration ttl = Duration.ofHours(24);
  private String keyPrefix = "reviewlens:cache:";

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "reviewlens.cache.similarity-threshold must be in (0.0, 1.0], got: "
              + similarityThreshold);
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalStateException("reviewlens.cache.ttl must be positive, got: " + ttl);
    }
    if (keyPrefix == null || keyPrefix.isBlank()) {
      throw new IllegalStateException("reviewlens.cache.key-prefix must not be blank");
    }
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }
}
