package tech.scytalesystems.tiered_cache_starter.aside;

import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;
import tech.scytalesystems.tiered_cache_starter.key.CacheKeys;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1535h
 * <p>Where and for how long a computed value is cached.
 *
 * @param ttl       time to live, null for each tier's default
 * @param namespace key namespace, {@code "default"} when blank
 * @param tiers     tiers to write, all tiers when empty
 */
public record CacheOptions(Duration ttl, String namespace, Set<CacheTier> tiers) {
    public CacheOptions {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }

        namespace = CacheKeys.namespaceOrDefault(namespace);
        tiers = tiers == null || tiers.isEmpty() ? Set.copyOf(EnumSet.allOf(CacheTier.class)) : Set.copyOf(tiers);
    }

    public static CacheOptions defaults() {
        return new CacheOptions(null, null, null);
    }

    public static CacheOptions of(Duration ttl, String namespace) {
        return new CacheOptions(ttl, namespace, null);
    }

    public CacheOptions withTtl(Duration ttl) {
        return new CacheOptions(ttl, namespace, tiers);
    }

    public CacheOptions withNamespace(String namespace) {
        return new CacheOptions(ttl, namespace, tiers);
    }

    public CacheOptions withTiers(Set<CacheTier> tiers) {
        return new CacheOptions(ttl, namespace, tiers);
    }
}
