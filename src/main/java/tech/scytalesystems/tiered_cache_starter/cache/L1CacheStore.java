package tech.scytalesystems.tiered_cache_starter.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.metrics.TieredCacheMetrics;
import tech.scytalesystems.tiered_cache_starter.util.CompressionUtil;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1140h
 * <p>Bounded, thread-safe, in-process store backing the L1 tier.
 *
 * <p>Structure:
 * <p>- an access-ordered map: iteration order is least-recently-used first, so the map's key
 * order is the LRU list and can never hold a key twice or a key outside the map
 * <p>- an expiry index ordered by expiry time, so the expired sweep only touches entries
 * that are actually expired
 *
 * <p>Every operation runs under one lock. {@link #set} does sweep, evict and insert as one
 * atomic step.
 */
public class L1CacheStore {
    private static final Logger log = LoggerFactory.getLogger(L1CacheStore.class);

    static final String REASON_LRU = "lru";
    static final String REASON_EXPIRED = "expired";

    private final int maxSize;
    private final Duration defaultTtl;
    private final boolean compressionEnabled;
    private final int compressionThreshold;
    private final int compressionLevel;
    private final Ticker ticker;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries;
    private final NavigableSet<CacheEntry> expiryIndex = new TreeSet<>(
            Comparator.comparingLong(CacheEntry::getExpiresAt).thenComparingLong(CacheEntry::getSequence));

    private long totalSizeBytes;
    private long hits;
    private long misses;
    private long lruEvictions;
    private long expiredEvictions;

    private TieredCacheMetrics metrics;

    public L1CacheStore(TieredCacheProperties props) {
        this(props, Ticker.systemTicker());
    }

    public L1CacheStore(TieredCacheProperties props, Ticker ticker) {
        TieredCacheProperties.Local local = props.getLocal();

        if (local.getMaxSize() < 1) throw new IllegalArgumentException("L1 max size must be at least 1");
        if (local.getTtl() == null || local.getTtl().isZero() || local.getTtl().isNegative()) {
            throw new IllegalArgumentException("L1 TTL must be positive: " + local.getTtl());
        }

        this.maxSize = local.getMaxSize();
        this.defaultTtl = local.getTtl();
        this.compressionEnabled = props.isCompressionEnabled();
        this.compressionThreshold = local.getCompressionThreshold();
        this.compressionLevel = props.getCompressionLevel();
        this.ticker = ticker;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the payload stored under {@code key}, or null when it is absent or expired.
     * A hit moves the key to the most-recently-used end.
     */
    public byte[] get(String key) {
        lock.lock();
        try {
            long now = ticker.read();
            evictExpired(now);

            // Access-ordered map: get() marks the key as most recently used
            CacheEntry entry = entries.get(key);

            if (entry == null) {
                misses++;
                return null;
            }

            if (entry.isExpired(now)) {
                removeEntry(key);
                recordEviction(REASON_EXPIRED);
                misses++;
                return null;
            }

            byte[] payload = entry.hit();

            if (!entry.isCompressed()) {
                hits++;
                return payload;
            }

            try {
                byte[] decompressed = CompressionUtil.decompress(payload);
                hits++;
                return decompressed;
            } catch (IOException e) {
                log.warn("Dropping corrupt L1 entry for key: {}, error: {}", key, e.getMessage());
                removeEntry(key);
                misses++;
                return null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code payload} under {@code key} for {@code ttl} (the L1 default when null),
     * evicting least-recently-used entries while the store is full.
     *
     * @return true when stored
     */
    public boolean set(String key, byte[] payload, Duration ttl) {
        if (key == null || payload == null) throw new IllegalArgumentException("Key and payload cannot be null");

        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;

        if (effectiveTtl.isNegative() || effectiveTtl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + effectiveTtl);
        }

        // Compress outside the lock, it only depends on the payload
        byte[] stored = payload;
        boolean compressed = false;

        if (compressionEnabled) {
            try {
                byte[] smaller = CompressionUtil.compressIfSmaller(payload, compressionThreshold, compressionLevel);

                if (smaller != null) {
                    stored = smaller;
                    compressed = true;
                }
            } catch (IOException e) {
                log.warn("L1 compression failed for key: {}, storing raw bytes: {}", key, e.getMessage());
            }
        }

        lock.lock();
        try {
            long now = ticker.read();
            evictExpired(now);

            // Replacing a key never evicts another one
            removeEntry(key);
            evictLru();

            CacheEntry entry = new CacheEntry(key, stored, now, effectiveTtl.toNanos(), compressed);
            entries.put(key, entry);
            expiryIndex.add(entry);
            totalSizeBytes += entry.getSizeBytes();

            if (metrics != null) metrics.recordMemoryUsage(CacheTier.L1, totalSizeBytes);

            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true when the key was present
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            return removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every key accepted by {@code matcher}.
     *
     * @return number of keys removed
     */
    public int removeMatching(Predicate<String> matcher) {
        lock.lock();
        try {
            List<String> matched = new ArrayList<>();

            for (String key : entries.keySet()) {
                if (matcher.test(key)) matched.add(key);
            }

            matched.forEach(this::removeEntry);

            return matched.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            expiryIndex.clear();
            totalSizeBytes = 0;

            if (metrics != null) metrics.recordMemoryUsage(CacheTier.L1, 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Maintenance sweep: drops every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanUp() {
        lock.lock();
        try {
            return evictExpired(ticker.read());
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(String key) {
        lock.lock();
        try {
            // containsKey() leaves the access order alone
            evictExpired(ticker.read());
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of reads served for a live key, or -1 when the key is absent.
     */
    public long hitCount(String key) {
        lock.lock();
        try {
            evictExpired(ticker.read());
            // get() would move the key to the MRU end
            for (CacheEntry entry : entries.values()) {
                if (entry.getKey().equals(key)) return entry.getHitCount();
            }
            return -1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the keys, least recently used first.
     */
    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public TieredCacheStats.Local getStats() {
        lock.lock();
        try {
            int size = entries.size();
            long requests = hits + misses;
            double hitRate = requests > 0 ? (hits * 100.0) / requests : 0.0;

            return new TieredCacheStats.Local(
                    size,
                    maxSize,
                    round((size * 100.0) / maxSize),
                    totalSizeBytes,
                    round(hitRate),
                    hits,
                    misses,
                    size > 0 ? round((double) totalSizeBytes / size) : 0.0,
                    lruEvictions,
                    expiredEvictions);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setMetrics(TieredCacheMetrics metrics) {
        this.metrics = metrics;
    }

    // Lock held by callers from here on

    private int evictExpired(long now) {
        int removed = 0;

        while (!expiryIndex.isEmpty() && expiryIndex.first().isExpired(now)) {
            CacheEntry expired = expiryIndex.pollFirst();

            if (entries.remove(expired.getKey(), expired)) {
                totalSizeBytes -= expired.getSizeBytes();
                recordEviction(REASON_EXPIRED);
                removed++;
            }
        }

        if (removed > 0) {
            log.trace("Swept {} expired L1 entries", removed);

            if (metrics != null) metrics.recordMemoryUsage(CacheTier.L1, totalSizeBytes);
        }

        return removed;
    }

    private void evictLru() {
        Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();

        while (entries.size() >= maxSize && eldest.hasNext()) {
            CacheEntry victim = eldest.next().getValue();
            eldest.remove();
            expiryIndex.remove(victim);
            totalSizeBytes -= victim.getSizeBytes();
            recordEviction(REASON_LRU);

            log.trace("Evicted LRU key from L1: {}", victim.getKey());
        }
    }

    private CacheEntry removeEntry(String key) {
        CacheEntry removed = entries.remove(key);

        if (removed != null) {
            expiryIndex.remove(removed);
            totalSizeBytes -= removed.getSizeBytes();

            if (metrics != null) metrics.recordMemoryUsage(CacheTier.L1, totalSizeBytes);
        }

        return removed;
    }

    private void recordEviction(String reason) {
        if (REASON_LRU.equals(reason)) lruEvictions++;
        else expiredEvictions++;

        if (metrics != null) metrics.recordEviction(CacheTier.L1, reason);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
