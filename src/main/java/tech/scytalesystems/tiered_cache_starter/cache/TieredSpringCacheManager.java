package tech.scytalesystems.tiered_cache_starter.cache;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 0940h
 * <p>Spring {@link CacheManager} over the tiered cache, so {@code @Cacheable} and friends
 * read and write all three tiers.
 * <p>Every cache name maps to a namespace of the same name. Caches are created on first use.
 */
public class TieredSpringCacheManager implements CacheManager {
    private final TieredCacheManager cacheManager;
    private final Duration ttl;
    private final ConcurrentMap<String, TieredCache> caches = new ConcurrentHashMap<>();

    /**
     * @param ttl time to live of entries written through Spring caches, null for each tier's default
     */
    public TieredSpringCacheManager(TieredCacheManager cacheManager, Duration ttl) {
        this.cacheManager = cacheManager;
        this.ttl = ttl;
    }

    @Override
    public Cache getCache(@NonNull String name) {
        return caches.computeIfAbsent(name, n -> new TieredCache(n, cacheManager, ttl));
    }

    @Override
    public @NonNull Collection<String> getCacheNames() {
        return List.copyOf(caches.keySet());
    }
}
