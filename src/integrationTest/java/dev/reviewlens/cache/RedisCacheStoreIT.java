package dev.reviewlens.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@SpringBootTest(properties = "reviewlens.cache.store=redis")
@ActiveProfiles("test")
@Testcontainers
class RedisCacheStoreIT {

  @Container
  @ServiceConnection(name = "redis")
  static GenericContainer<?> redis =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  @Autowired CacheStore cacheStore;

  @Autowired SemanticResultCache cache;

  @Autowired StringRedisTemplate redisTemplate;

  @Autowired CacheProperties properties;

  @BeforeEach
  void clearCache() {
    cache.clear();
  }

  @Test
  void redis_store_is_selected() {
    assertThat(cacheStore).isInstanceOf(RedisCacheStore.class);
  }

  @Test
  void put_sets_value_and_expiry_in_one_write() {
    cacheStore.put("it:key", "value", Duration.ofMinutes(5));

    assertThat(cacheStore.get("it:key")).contains("value");
    assertThat(redisTemplate.getExpire("it:key")).isBetween(1L, 300L);
    cacheStore.delete("it:key");
  }

  @Test
  void scan_finds_keys_by_prefix() {
    cacheStore.put("it:scan:a", "1", Duration.ofMinutes(5));
    cacheStore.put("it:scan:b", "2", Duration.ofMinutes(5));
    cacheStore.put("it:other", "3", Duration.ofMinutes(5));

    assertThat(cacheStore.scanKeys("it:scan:")).containsExactlyInAnyOrder("it:scan:a", "it:scan:b");

    cacheStore.delete("it:scan:a");
    cacheStore.delete("it:scan:b");
    cacheStore.delete("it:other");
  }

  @Test
  void semantic_cache_round_trip_through_redis() {
    cache.store("Is the staff in Paris friendly?", "Mostly, yes.", 4);

    CacheLookup lookup = cache.lookup("Is the staff in Paris friendly?");

    assertThat(lookup.isHit()).isTrue();
    assertThat(lookup.entry().answer()).isEqualTo("Mostly, yes.");
    assertThat(lookup.entry().contextCount()).isEqualTo(4);
    String key = properties.getKeyPrefix() + QueryHasher.identifier("Is the staff in Paris friendly?");
    assertThat(redisTemplate.hasKey(key)).isTrue();
    assertThat(redisTemplate.getExpire(key)).isPositive();
  }

  @Test
  void clear_then_stats_reports_zero_entries() {
    cache.store("What about the food?", "Expensive.", 2);
    assertThat(cache.stats().entryCount()).isEqualTo(1);

    cache.clear();

    assertThat(cache.stats().entryCount()).isZero();
  }
}
