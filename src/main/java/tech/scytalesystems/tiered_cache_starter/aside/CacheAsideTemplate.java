package tech.scytalesystems.tiered_cache_starter.aside;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.key.CacheKeyGenerator;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1550h
 * <p>Lookup-or-compute on top of {@link TieredCacheManager}.
 *
 * <p>Flow:
 * <p>1. Look the key up through every tier
 * <p>2. On a hit, return the cached value
 * <p>3. On a miss, run the computation, store a non-null result with the given options and return it
 *
 * <p>Usage:
 * <pre>
 * Function&lt;Long, Event&gt; findEvent = cacheAside.cached(
 *         id -&gt; "event:" + id,
 *         CacheOptions.of(Duration.ofMinutes(10), "events"),
 *         eventRepository::findById);
 * </pre>
 *
 * <p>Concurrent misses on the same key each run the computation, the last write wins.
 */
public class CacheAsideTemplate {
    private static final Logger log = LoggerFactory.getLogger(CacheAsideTemplate.class);

    private final TieredCacheManager cacheManager;

    public CacheAsideTemplate(TieredCacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    /**
     * @throws CacheComputationException when the computation throws a checked exception
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, CacheOptions options, Callable<T> computation) {
        Optional<Object> cached = cacheManager.get(key, options.namespace());

        if (cached.isPresent()) {
            log.trace("Cache-aside hit: {}", key);
            return (T) cached.get();
        }

        T value;
        try {
            value = computation.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheComputationException(key, e);
        }

        if (value == null) {
            log.debug("Computation for key: {} returned null, not caching", key);
            return null;
        }

        if (!cacheManager.set(key, value, options.ttl(), options.namespace(), options.tiers())) {
            log.debug("Computed value for key: {} was not stored on every tier", key);
        }

        return value;
    }

    /**
     * Same as {@link #getOrCompute(String, CacheOptions, Callable)} with a key derived from
     * {@code operation} and its named {@code arguments}.
     */
    public <T> T getOrCompute(String operation, Map<String, ?> arguments, CacheOptions options, Callable<T> computation) {
        return getOrCompute(CacheKeyGenerator.generate(operation, arguments), options, computation);
    }

    /**
     * Wraps {@code function} so every call goes through the cache, keyed by {@code keyFunction}.
     */
    public <A, R> Function<A, R> cached(Function<? super A, String> keyFunction, CacheOptions options,
                                        Function<? super A, ? extends R> function) {
        return argument -> getOrCompute(keyFunction.apply(argument), options, () -> function.apply(argument));
    }

    public TieredCacheManager getCacheManager() {
        return cacheManager;
    }
}
