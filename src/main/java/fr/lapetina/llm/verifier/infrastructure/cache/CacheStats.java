package fr.lapetina.llm.verifier.infrastructure.cache;

import java.time.Instant;

/**
 * Snapshot of cache counters. {@code hitRate} is a percentage in [0,100].
 */
public record CacheStats(
        long hits,
        long misses,
        double hitRate,
        int totalItems,
        Instant lastCleanup
) {
    static CacheStats of(long hits, long misses, int totalItems, Instant lastCleanup) {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits * 100.0 / lookups;
        return new CacheStats(hits, misses, hitRate, totalItems, lastCleanup);
    }
}
