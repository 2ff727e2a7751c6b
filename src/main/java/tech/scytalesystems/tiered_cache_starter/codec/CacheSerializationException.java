package tech.scytalesystems.tiered_cache_starter.codec;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1040h
 * <p>A value could not be encoded, or stored bytes could not be decoded back into a value.
 */
public class CacheSerializationException extends RuntimeException {

    public CacheSerializationException(String message) {
        super(message);
    }

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
