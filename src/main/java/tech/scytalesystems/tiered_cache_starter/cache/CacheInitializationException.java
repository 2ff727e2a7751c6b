package tech.scytalesystems.tiered_cache_starter.cache;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1405h
 * <p>A remote tier could not be reached while the cache was starting. This is the only
 * cache failure that propagates: it stops application startup.
 */
public class CacheInitializationException extends RuntimeException {

    public CacheInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
