package tech.scytalesystems.tiered_cache_starter.aside;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1540h
 * <p>Wraps a checked exception thrown by a computation run on a cache miss.
 */
public class CacheComputationException extends RuntimeException {
    private final String key;

    public CacheComputationException(String key, Throwable cause) {
        super("Computation failed for cache key: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
