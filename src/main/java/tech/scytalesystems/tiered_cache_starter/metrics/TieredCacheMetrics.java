package tech.scytalesystems.tiered_cache_starter.metrics;

import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1105h
 * <p>
 * Optional interface for collecting cache metrics.
 * Components hold a nullable reference and skip recording when none is set.
 */
public interface TieredCacheMetrics {
    /**
     * Called when a tier serves a value.
     *
     * @param tier    The tier that answered.
     * @param keyType The key category (user, event, ... or other).
     */
    void recordHit(CacheTier tier, String keyType);

    /**
     * Called when a tier does not hold the key. {@code tier} is null for an overall miss.
     */
    void recordMiss(CacheTier tier, String keyType);

    /**
     * Records how long an operation took at a tier.
     *
     * @param operation   get, set, delete, invalidate or get_total
     * @param tier        The tier that was touched, or null for the whole hierarchy.
     * @param nanos       Elapsed time in nanoseconds.
     */
    void recordDuration(String operation, CacheTier tier, long nanos);

    /**
     * Called when an entry is removed without being asked to, e.g. {@code lru} or {@code expired}.
     */
    void recordEviction(CacheTier tier, String reason);

    /**
     * Publishes the memory currently used by a tier.
     */
    void recordMemoryUsage(CacheTier tier, long bytes);

    /**
     * Called after a pattern invalidation.
     */
    void recordInvalidation(String namespace, long count);
}
