package tech.scytalesystems.tiered_cache_starter.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 0920h
 * <p>Value held by the {@link L1CacheStore}.
 * <p>Timestamps come from the store's ticker (nanoseconds, monotonic). An entry whose
 * expiry has passed is logically absent even while it is still in the map.
 */
public final class CacheEntry {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String key;
    private final byte[] payload;
    private final long createdAt;
    private final long expiresAt;
    private final boolean compressed;
    private final long sequence;
    private long hitCount;

    CacheEntry(String key, byte[] payload, long createdAt, long ttlNanos, boolean compressed) {
        if (ttlNanos <= 0) throw new IllegalArgumentException("TTL must be positive");

        this.key = key;
        this.payload = payload;
        this.createdAt = createdAt;
        this.expiresAt = createdAt + ttlNanos;
        this.compressed = compressed;
        this.sequence = SEQUENCE.incrementAndGet();
    }

    boolean isExpired(long now) {
        return now - expiresAt > 0;
    }

    // Callers hold the store lock
    byte[] hit() {
        hitCount++;
        return payload;
    }

    // GETTERS
    public String getKey() {
        return key;
    }

    public byte[] getPayload() {
        return payload;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public long getHitCount() {
        return hitCount;
    }

    public int getSizeBytes() {
        return payload.length;
    }

    public boolean isCompressed() {
        return compressed;
    }

    long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "key='" + key + '\'' +
                ", sizeBytes=" + payload.length +
                ", compressed=" + compressed +
                ", hitCount=" + hitCount +
                '}';
    }
}
