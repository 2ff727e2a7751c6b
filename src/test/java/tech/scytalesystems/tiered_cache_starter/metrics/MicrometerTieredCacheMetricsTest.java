package tech.scytalesystems.tiered_cache_starter.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1130h
 */
@DisplayName("MicrometerTieredCacheMetrics Tests")
class MicrometerTieredCacheMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerTieredCacheMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerTieredCacheMetrics(registry);
    }

    @Test
    @DisplayName("Should count hits and misses by tier and key type")
    void testHitsAndMisses() {
        metrics.recordHit(CacheTier.L1, "user");
        metrics.recordHit(CacheTier.L1, "user");
        metrics.recordHit(CacheTier.L3, "event");
        metrics.recordMiss(CacheTier.L2, "user");
        metrics.recordMiss(null, "user");

        assertEquals(2.0, registry.get("cache.hits").tag("tier", "L1").tag("key_type", "user").counter().count());
        assertEquals(1.0, registry.get("cache.hits").tag("tier", "L3").tag("key_type", "event").counter().count());
        assertEquals(1.0, registry.get("cache.misses").tag("tier", "L2").counter().count());
        assertEquals(1.0, registry.get("cache.misses").tag("tier", "all").counter().count());
    }

    @Test
    @DisplayName("Should time operations per tier")
    void testDuration() {
        metrics.recordDuration("get", CacheTier.L2, TimeUnit.MILLISECONDS.toNanos(3));
        metrics.recordDuration("get", CacheTier.L2, TimeUnit.MILLISECONDS.toNanos(5));
        metrics.recordDuration("invalidate", null, TimeUnit.MILLISECONDS.toNanos(1));

        assertEquals(2, registry.get("cache.operation.duration").tag("operation", "get").tag("tier", "L2").timer().count());
        assertEquals(8.0, registry.get("cache.operation.duration").tag("operation", "get").timer()
                .totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.get("cache.operation.duration").tag("tier", "all").timer().count());
    }

    @Test
    @DisplayName("Should count evictions and invalidations")
    void testEvictionsAndInvalidations() {
        metrics.recordEviction(CacheTier.L1, "lru");
        metrics.recordEviction(CacheTier.L1, "expired");
        metrics.recordEviction(CacheTier.L1, "expired");
        metrics.recordInvalidation("users", 12);

        assertEquals(1.0, registry.get("cache.evictions").tag("reason", "lru").counter().count());
        assertEquals(2.0, registry.get("cache.evictions").tag("reason", "expired").counter().count());
        assertEquals(12.0, registry.get("cache.invalidations").tag("namespace", "users").counter().count());
    }

    @Test
    @DisplayName("Should expose memory usage gauges for every tier")
    void testMemoryUsage() {
        metrics.recordMemoryUsage(CacheTier.L1, 4096);
        metrics.recordMemoryUsage(CacheTier.L2, 1_048_576);

        assertEquals(4096.0, registry.get("cache.memory.usage").tag("tier", "L1").gauge().value());
        assertEquals(1_048_576.0, registry.get("cache.memory.usage").tag("tier", "L2").gauge().value());
        assertEquals(0.0, registry.get("cache.memory.usage").tag("tier", "L3").gauge().value());
    }
}
