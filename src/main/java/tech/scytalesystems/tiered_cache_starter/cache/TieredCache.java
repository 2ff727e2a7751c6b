package tech.scytalesystems.tiered_cache_starter.cache;

import org.springframework.cache.Cache;
import org.springframework.cache.support.SimpleValueWrapper;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * @param name         cache name, used as the namespace on every tier
 * @param cacheManager the tiered cache manager
 * @param ttl          time to live of entries put through this cache, null for each tier's default
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 0915h
 * <p>Spring {@link Cache} view of one namespace of the {@link TieredCacheManager}.
 *
 * <p>Read strategy: L1 -> L2 -> L3 (promoting on slower hits)
 * <p>Write strategy: Write-through to every tier
 * <p>Null values are not stored: putting null evicts the key.
 */
public record TieredCache(String name, TieredCacheManager cacheManager, Duration ttl) implements Cache {
    @Override
    public @NonNull String getName() {
        return name;
    }

    @Override
    public @NonNull Object getNativeCache() {
        return cacheManager;
    }

    @Override
    public ValueWrapper get(@NonNull Object key) {
        return cacheManager.get(toKey(key), name)
                .map(SimpleValueWrapper::new)
                .orElse(null);
    }

    @Override
    public <T> T get(@NonNull Object key, Class<T> type) {
        Optional<Object> value = cacheManager.get(toKey(key), name);

        if (value.isEmpty()) return null;

        if (type != null && !type.isInstance(value.get())) {
            throw new IllegalStateException("Cached value is not of required type [" + type.getName() + "]: " + value.get());
        }

        @SuppressWarnings("unchecked")
        T typed = (T) value.get();
        return typed;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(@NonNull Object key, @NonNull Callable<T> valueLoader) {
        Optional<Object> cached = cacheManager.get(toKey(key), name);

        if (cached.isPresent()) return (T) cached.get();

        // Load value and write it through
        try {
            T value = valueLoader.call();
            put(key, value);

            return value;
        } catch (Exception e) {
            throw new ValueRetrievalException(key, valueLoader, e);
        }
    }

    @Override
    public void put(@NonNull Object key, Object value) {
        if (value == null) {
            evict(key);
            return;
        }

        cacheManager.set(toKey(key), value, ttl, name);
    }

    @Override
    public ValueWrapper putIfAbsent(@NonNull Object key, Object value) {
        ValueWrapper existingValue = get(key);

        if (existingValue != null) return existingValue;

        put(key, value);
        return null;
    }

    @Override
    public void evict(@NonNull Object key) {
        cacheManager.delete(toKey(key), name);
    }

    @Override
    public void clear() {
        cacheManager.invalidatePattern("*", name);
    }

    private static String toKey(Object key) {
        return String.valueOf(key);
    }
}
