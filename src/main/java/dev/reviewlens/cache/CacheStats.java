package dev.reviewlens.cache;

import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Read-only snapshot of the live (non-expired) cache entries.
 *
 * @param entryCount number of live entries
 * @param oldestEntry creation time of the oldest live entry, null when empty
 * @param newestEntry creation time of the newest live entry, null when empty
 * @param similarityThreshold configured hit threshold
 * @param ttl configured entry time-to-live
 */
public record CacheStats(
    int entryCount,
    @Nullable Instant oldestEntry,
    @Nullable Instant newestEntry,
    double similarityThreshold,
    Duration ttl) {}
