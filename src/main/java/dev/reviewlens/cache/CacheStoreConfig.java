package dev.reviewlens.cache;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the {@link CacheStore} implementation with {@code reviewlens.cache.store}.
 *
 * <p>{@code redis} uses the auto-configured {@link StringRedisTemplate} ({@code spring.data.redis.*}
 * connection settings); {@code in-memory} (default) keeps entries in the JVM and loses them on
 * restart.
 */
@Configuration
public class CacheStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreConfig.class);

    /** Timestamps cache entries and decides their expiry. Tests substitute a movable clock. */
    @Bean
    @ConditionalOnMissingBean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "reviewlens.cache.store", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate) {
        log.info("Semantic cache backed by Redis");
        return new RedisCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "reviewlens.cache.store", havingValue = "in-memory",
            matchIfMissing = true)
    public CacheStore inMemoryCacheStore(Clock clock) {
        log.info("Semantic cache backed by in-memory store");
        return new InMemoryCacheStore(clock);
    }
}
