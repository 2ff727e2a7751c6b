package tech.scytalesystems.tiered_cache_starter.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheStats;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.key.CacheKeys;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 1105h
 * <p>
 * Spring Boot Actuator endpoint for the tiered cache.
 * <p>
 * Access via: /actuator/tiered-cache
 * <p>
 * Features:
 * - View per-tier statistics and configuration
 * - Invalidate a key pattern in a namespace on every tier
 * - Delete a single key on every tier
 * <p>
 * Configuration:
 * management.endpoints.web.exposure.include=tiered-cache
 */
@Endpoint(id = "tiered-cache")
public class TieredCacheEndpoint {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheEndpoint.class);

    private final TieredCacheManager cacheManager;
    private final Instant startupTime;

    public TieredCacheEndpoint(TieredCacheManager cacheManager) {
        this.cacheManager = cacheManager;
        this.startupTime = Instant.now();
    }

    /**
     * GET /actuator/tiered-cache
     * <p>
     * Returns the statistics of every tier with the effective configuration.
     */
    @ReadOperation
    public Map<String, Object> info() {
        TieredCacheProperties props = cacheManager.getProperties();
        TieredCacheStats stats = cacheManager.getStats();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", cacheManager.isInitialized() ? "UP" : "DOWN");
        result.put("uptime", formatUptime(Duration.between(startupTime, Instant.now())));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("keyPrefix", props.getKeyPrefix());
        config.put("compressionEnabled", props.isCompressionEnabled());
        config.put("compressionLevel", props.getCompressionLevel());
        config.put("maxValueSize", props.getMaxValueSize().toString());
        config.put("l1MaxSize", props.getLocal().getMaxSize());
        config.put("l1Ttl", props.getLocal().getTtl().toString());
        config.put("l2Enabled", props.getL2().isEnabled());
        config.put("l2Ttl", props.getL2().getTtl().toString());
        config.put("l3Enabled", props.getL3().isEnabled());
        config.put("l3Ttl", props.getL3().getTtl().toString());
        result.put("configuration", config);

        result.put("overall", stats.overall());
        result.put("l1", stats.l1());
        result.put("l2", stats.l2());
        result.put("l3", stats.l3());
        result.put("recentInvalidations", stats.recentInvalidations());

        return result;
    }

    /**
     * POST /actuator/tiered-cache
     * <p>
     * Body: {"pattern": "user:*", "namespace": "users"}
     */
    @WriteOperation
    public Map<String, Object> invalidate(String pattern, @Nullable String namespace) {
        String effectiveNamespace = CacheKeys.namespaceOrDefault(namespace);

        log.info("Invalidation requested via endpoint - namespace: {}, pattern: {}", effectiveNamespace, pattern);

        long invalidated = cacheManager.invalidatePattern(pattern, effectiveNamespace);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("namespace", effectiveNamespace);
        result.put("pattern", pattern);
        result.put("invalidated", invalidated);

        return result;
    }

    /**
     * DELETE /actuator/tiered-cache/{namespace}/{key}
     */
    @DeleteOperation
    public Map<String, Object> evict(@Selector String namespace, @Selector String key) {
        log.info("Eviction requested via endpoint - namespace: {}, key: {}", namespace, key);

        boolean success = cacheManager.delete(key, namespace);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("namespace", namespace);
        result.put("key", key);
        result.put("success", success);

        return result;
    }

    private static String formatUptime(Duration uptime) {
        return String.format("%dd %dh %dm %ds", uptime.toDays(), uptime.toHoursPart(),
                uptime.toMinutesPart(), uptime.toSecondsPart());
    }
}
