package tech.scytalesystems.tiered_cache_starter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1120h
 * <p>
 * Micrometer backed {@link TieredCacheMetrics}.
 * <p>
 * Meters:
 * <pre>
 * - cache.hits                : Counter (tier, key_type)
 * - cache.misses              : Counter (tier, key_type), tier=all for an overall miss
 * - cache.operation.duration  : Timer   (operation, tier)
 * - cache.evictions           : Counter (tier, reason)
 * - cache.memory.usage        : Gauge   (tier)
 * - cache.invalidations       : Counter (namespace)
 * </pre>
 */
public class MicrometerTieredCacheMetrics implements TieredCacheMetrics {
    private static final Logger log = LoggerFactory.getLogger(MicrometerTieredCacheMetrics.class);

    private static final String ALL_TIERS = "all";

    private final MeterRegistry registry;

    // Gauge backing fields, registered once per tier
    private final Map<CacheTier, AtomicLong> memoryUsage = new EnumMap<>(CacheTier.class);

    public MicrometerTieredCacheMetrics(MeterRegistry registry) {
        this.registry = registry;

        for (CacheTier tier : CacheTier.values()) {
            AtomicLong usage = new AtomicLong();
            memoryUsage.put(tier, usage);

            Gauge.builder("cache.memory.usage", usage, AtomicLong::get)
                    .description("Memory used by a cache tier")
                    .baseUnit("bytes")
                    .tag("tier", tier.label())
                    .register(registry);
        }

        log.info("MicrometerTieredCacheMetrics initialized - counters, timers and memory gauges registered");
    }

    @Override
    public void recordHit(CacheTier tier, String keyType) {
        Counter.builder("cache.hits")
                .description("Cache hit count")
                .tag("tier", tierTag(tier))
                .tag("key_type", keyType)
                .register(registry)
                .increment();
    }

    @Override
    public void recordMiss(CacheTier tier, String keyType) {
        Counter.builder("cache.misses")
                .description("Cache miss count")
                .tag("tier", tierTag(tier))
                .tag("key_type", keyType)
                .register(registry)
                .increment();
    }

    @Override
    public void recordDuration(String operation, CacheTier tier, long nanos) {
        Timer.builder("cache.operation.duration")
                .description("Cache operation duration")
                .tag("operation", operation)
                .tag("tier", tierTag(tier))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordEviction(CacheTier tier, String reason) {
        Counter.builder("cache.evictions")
                .description("Cache eviction count")
                .tag("tier", tierTag(tier))
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordMemoryUsage(CacheTier tier, long bytes) {
        memoryUsage.get(tier).set(bytes);
    }

    @Override
    public void recordInvalidation(String namespace, long count) {
        Counter.builder("cache.invalidations")
                .description("Keys removed by pattern invalidation")
                .tag("namespace", namespace)
                .register(registry)
                .increment(count);
    }

    private static String tierTag(CacheTier tier) {
        return tier != null ? tier.label() : ALL_TIERS;
    }
}
