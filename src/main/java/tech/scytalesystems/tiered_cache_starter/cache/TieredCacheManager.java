package tech.scytalesystems.tiered_cache_starter.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.codec.CacheSerializationException;
import tech.scytalesystems.tiered_cache_starter.codec.ValueSerializer;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.key.CacheKeys;
import tech.scytalesystems.tiered_cache_starter.key.KeyPattern;
import tech.scytalesystems.tiered_cache_starter.metrics.TieredCacheMetrics;
import tech.scytalesystems.tiered_cache_starter.remote.RemoteTierClient;
import tech.scytalesystems.tiered_cache_starter.remote.TierResult;
import tech.scytalesystems.tiered_cache_starter.util.CompressionUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1420h
 * <p>Orchestrates the three cache tiers:
 * <p>- L1 ({@link L1CacheStore}): in-process, bounded, LRU
 * <p>- L2 ({@link RemoteTierClient}): local Redis
 * <p>- L3 ({@link RemoteTierClient}): distant, larger Redis
 *
 * <p>Read strategy: L1 → L2 → L3. A hit at a slower tier is copied into every faster tier
 * (promotion) with that tier's default TTL.
 * <p>Write strategy: encode once, then write every requested tier independently.
 *
 * <p>Failure policy: a remote tier that fails or times out is logged and treated as a miss
 * (fail-open). Callers of {@link #get} only ever see a value or empty.
 *
 * <p>There is no cross-tier atomicity and concurrent misses on the same key are not
 * de-duplicated. Every entry carries a TTL, which bounds how long a stale copy can live.
 *
 * <p>Lifecycle: construct once per process, call {@link #initialize()} before use and
 * {@link #close()} on shutdown.
 */
public class TieredCacheManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheManager.class);

    private static final Set<CacheTier> ALL_TIERS = EnumSet.allOf(CacheTier.class);
    private static final int RECENT_INVALIDATIONS_LIMIT = 100;

    private final TieredCacheProperties props;
    private final CacheKeys keys;
    private final L1CacheStore l1;
    private final RemoteTierClient l2;
    private final RemoteTierClient l3;
    private final ValueSerializer serializer;
    private final long maxValueBytes;

    private final LongAdder l1Hits = new LongAdder();
    private final LongAdder l2Hits = new LongAdder();
    private final LongAdder l3Hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder promotions = new LongAdder();
    private final LongAdder remoteErrors = new LongAdder();

    private final LinkedHashSet<String> recentInvalidations = new LinkedHashSet<>();

    private volatile boolean initialized;

    /**
     * Optional metrics collaborator. Null means metrics are skipped.
     */
    private TieredCacheMetrics metrics;

    /**
     * @param l2 the L2 client, or null when the tier is disabled
     * @param l3 the L3 client, or null when the tier is disabled
     */
    public TieredCacheManager(TieredCacheProperties props, RemoteTierClient l2, RemoteTierClient l3) {
        this(props, new L1CacheStore(props), l2, l3, new ValueSerializer(props));
    }

    public TieredCacheManager(TieredCacheProperties props, L1CacheStore l1, RemoteTierClient l2,
                              RemoteTierClient l3, ValueSerializer serializer) {
        this.props = props;
        this.keys = new CacheKeys(props.getKeyPrefix(), props.getKeyCategories());
        this.l1 = l1;
        this.l2 = l2;
        this.l3 = l3;
        this.serializer = serializer;
        this.maxValueBytes = props.getMaxValueSize().toBytes();
    }

    /**
     * Checks every enabled remote tier.
     *
     * @throws CacheInitializationException if a tier cannot be reached
     */
    public void initialize() {
        for (RemoteTierClient client : remoteClients()) {
            TierResult<String> pong = client.ping();

            if (pong.isError()) {
                log.error("Cache initialization failed - {} unreachable: {}", client.tier(), pong.error().getMessage());
                throw new CacheInitializationException(client.tier() + " cache tier is unreachable", pong.error());
            }

            log.info("{} Redis cache connected", client.tier());
        }

        initialized = true;

        log.info("TieredCacheManager initialized - prefix: {}, l1MaxSize: {}, l2: {}, l3: {}, compression: {}",
                keys.getPrefix(), l1.getMaxSize(), l2 != null ? "enabled" : "disabled",
                l3 != null ? "enabled" : "disabled", props.isCompressionEnabled());
    }

    /**
     * Releases the remote tier connections. The L1 store keeps its entries.
     */
    @Override
    public void close() {
        for (RemoteTierClient client : remoteClients()) {
            client.close();
        }

        initialized = false;
        log.info("TieredCacheManager closed");
    }

    /**
     * Looks {@code key} up in {@code namespace}, tier by tier.
     *
     * @return the cached value, or empty when no tier holds it
     */
    public Optional<Object> get(String key, String namespace) {
        String cacheKey = keys.build(key, namespace);
        String keyType = keys.category(key);
        long start = System.nanoTime();

        // L1
        byte[] l1Payload = l1.get(cacheKey);

        if (l1Payload != null) {
            Optional<Object> value = decode(CacheTier.L1, cacheKey, l1Payload);

            if (value.isPresent()) {
                l1Hits.increment();
                recordHit(CacheTier.L1, keyType, start);
                return value;
            }

            // Corrupt copy, the slower tiers may still hold a good one
            l1.delete(cacheKey);
        }

        if (metrics != null) metrics.recordMiss(CacheTier.L1, keyType);

        // L2
        if (l2 != null) {
            byte[] payload = remoteGet(l2, cacheKey, keyType);
            Optional<Object> value = payload != null ? decode(CacheTier.L2, cacheKey, payload) : Optional.empty();

            if (value.isPresent()) {
                promoteToL1(cacheKey, payload);
                l2Hits.increment();
                recordHit(CacheTier.L2, keyType, start);
                return value;
            }
        }

        // L3
        if (l3 != null) {
            byte[] payload = remoteGet(l3, cacheKey, keyType);
            Optional<Object> value = payload != null ? decode(CacheTier.L3, cacheKey, payload) : Optional.empty();

            if (value.isPresent()) {
                promoteToL2(cacheKey, payload);
                promoteToL1(cacheKey, payload);
                l3Hits.increment();
                recordHit(CacheTier.L3, keyType, start);
                return value;
            }
        }

        misses.increment();

        if (metrics != null) {
            metrics.recordMiss(null, keyType);
            metrics.recordDuration("get_total", null, System.nanoTime() - start);
        }

        log.trace("Cache miss on every tier: {}", cacheKey);
        return Optional.empty();
    }

    /**
     * Typed lookup. A cached value of another type counts as a miss.
     */
    public <T> Optional<T> get(String key, String namespace, Class<T> type) {
        Optional<Object> value = get(key, namespace);

        if (value.isPresent() && !type.isInstance(value.get())) {
            log.warn("Cached value for key: {} is a {}, expected {}", key,
                    value.get().getClass().getName(), type.getName());
            return Optional.empty();
        }

        return value.map(type::cast);
    }

    /**
     * Stores {@code value} on every tier.
     *
     * @param ttl time to live, or null for each tier's default
     * @return true when every tier stored the value
     */
    public boolean set(String key, Object value, Duration ttl, String namespace) {
        return write(key, value, ttl, namespace, ALL_TIERS).success();
    }

    public boolean set(String key, Object value, Duration ttl, String namespace, Set<CacheTier> tiers) {
        return write(key, value, ttl, namespace, tiers).success();
    }

    /**
     * Encodes {@code value} once and writes it to each tier in {@code tiers} (all tiers when
     * null or empty). A failing tier does not stop the others.
     *
     * @param ttl time to live, or null for each tier's default
     */
    public WriteResult write(String key, Object value, Duration ttl, String namespace, Set<CacheTier> tiers) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }

        String cacheKey = keys.build(key, namespace);
        Set<CacheTier> requested = tiers == null || tiers.isEmpty() ? ALL_TIERS : tiers;

        byte[] payload;
        try {
            payload = serializer.encode(value);
        } catch (CacheSerializationException e) {
            log.error("Cache set rejected for key: {} - serialization failed: {}", cacheKey, e.getMessage(), e);
            return WriteResult.rejected(WriteResult.Rejection.SERIALIZATION_FAILED);
        }

        if (payload.length > maxValueBytes) {
            log.warn("Cache set rejected for key: {} - value is {}, limit is {}", cacheKey,
                    CompressionUtil.formatSize(payload.length), CompressionUtil.formatSize(maxValueBytes));
            return WriteResult.rejected(WriteResult.Rejection.VALUE_TOO_LARGE);
        }

        Map<CacheTier, TierResult.Status> outcomes = new EnumMap<>(CacheTier.class);

        if (requested.contains(CacheTier.L1)) {
            long start = System.nanoTime();
            l1.set(cacheKey, payload, ttl != null ? ttl : l1.getDefaultTtl());
            outcomes.put(CacheTier.L1, TierResult.Status.OK);

            if (metrics != null) metrics.recordDuration("set", CacheTier.L1, System.nanoTime() - start);
        }

        if (requested.contains(CacheTier.L2) && l2 != null) {
            outcomes.put(CacheTier.L2, remoteSet(l2, cacheKey, payload, ttl != null ? ttl : props.getL2().getTtl()));
        }

        if (requested.contains(CacheTier.L3) && l3 != null) {
            outcomes.put(CacheTier.L3, remoteSet(l3, cacheKey, payload, ttl != null ? ttl : props.getL3().getTtl()));
        }

        log.debug("Cache set: key={}, size={}, tiers={}", cacheKey, payload.length, outcomes);
        return new WriteResult(outcomes, null);
    }

    /**
     * Removes {@code key} from every tier. A tier that does not hold the key is not an error.
     *
     * @return false when a remote tier could not be reached
     */
    public boolean delete(String key, String namespace) {
        String cacheKey = keys.build(key, namespace);
        boolean success = true;

        l1.delete(cacheKey);

        for (RemoteTierClient client : remoteClients()) {
            TierResult<Long> deleted = client.delete(List.of(cacheKey));

            if (deleted.isError()) {
                remoteFailure(client.tier(), "delete", cacheKey, deleted.error());
                success = false;
            }
        }

        log.debug("Cache delete: key={}, success={}", cacheKey, success);
        return success;
    }

    /**
     * Removes every key of {@code namespace} matching the wildcard {@code pattern}
     * (e.g. {@code "user:*"}) from all tiers.
     *
     * @return number of keys removed, summed over the tiers
     */
    public long invalidatePattern(String pattern, String namespace) {
        String fullPattern = keys.build(pattern, namespace);
        long start = System.nanoTime();

        long invalidated = l1.removeMatching(KeyPattern.compile(fullPattern));

        for (RemoteTierClient client : remoteClients()) {
            invalidated += invalidateRemote(client, fullPattern);
        }

        rememberInvalidation(fullPattern);

        if (metrics != null) {
            metrics.recordInvalidation(CacheKeys.namespaceOrDefault(namespace), invalidated);
            metrics.recordDuration("invalidate", null, System.nanoTime() - start);
        }

        log.info("Cache invalidation: {} keys for pattern '{}'", invalidated, fullPattern);
        return invalidated;
    }

    public TieredCacheStats getStats() {
        long l1HitCount = l1Hits.sum();
        long l2HitCount = l2Hits.sum();
        long l3HitCount = l3Hits.sum();
        long missCount = misses.sum();
        long hitCount = l1HitCount + l2HitCount + l3HitCount;
        long totalRequests = hitCount + missCount;
        double hitRate = totalRequests > 0 ? Math.round(hitCount * 10_000.0 / totalRequests) / 100.0 : 0.0;

        TieredCacheStats.Overall overall = new TieredCacheStats.Overall(totalRequests, hitRate,
                l1HitCount, l2HitCount, l3HitCount, missCount, promotions.sum(), remoteErrors.sum());

        List<String> invalidations;
        synchronized (recentInvalidations) {
            invalidations = new ArrayList<>(recentInvalidations);
        }

        return new TieredCacheStats(overall, l1.getStats(),
                remoteStats(CacheTier.L2, l2), remoteStats(CacheTier.L3, l3), invalidations);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public L1CacheStore getL1Store() {
        return l1;
    }

    public CacheKeys getKeys() {
        return keys;
    }

    public TieredCacheProperties getProperties() {
        return props;
    }

    /**
     * Sets the metrics implementation (also handed to the L1 store).
     */
    public void setMetrics(TieredCacheMetrics metrics) {
        this.metrics = metrics;
        this.l1.setMetrics(metrics);
    }

    private byte[] remoteGet(RemoteTierClient client, String cacheKey, String keyType) {
        long start = System.nanoTime();
        TierResult<byte[]> result = client.get(cacheKey);

        if (metrics != null) metrics.recordDuration("get", client.tier(), System.nanoTime() - start);

        if (result.isOk()) return result.value();

        if (result.isError()) remoteFailure(client.tier(), "get", cacheKey, result.error());
        else if (metrics != null) metrics.recordMiss(client.tier(), keyType);

        return null;
    }

    private TierResult.Status remoteSet(RemoteTierClient client, String cacheKey, byte[] payload, Duration ttl) {
        long start = System.nanoTime();
        TierResult<Void> result = client.set(cacheKey, payload, ttl);

        if (metrics != null) metrics.recordDuration("set", client.tier(), System.nanoTime() - start);

        if (result.isError()) remoteFailure(client.tier(), "set", cacheKey, result.error());

        return result.status();
    }

    private long invalidateRemote(RemoteTierClient client, String fullPattern) {
        LongAdder deleted = new LongAdder();

        TierResult<Long> scanned = client.scan(fullPattern, props.getBatchInvalidationSize(), batch -> {
            TierResult<Long> result = client.delete(batch);

            if (result.isOk()) deleted.add(result.value());
            else if (result.isError()) remoteFailure(client.tier(), "invalidate", fullPattern, result.error());
        });

        if (scanned.isError()) remoteFailure(client.tier(), "scan", fullPattern, scanned.error());

        return deleted.sum();
    }

    private Optional<Object> decode(CacheTier tier, String cacheKey, byte[] payload) {
        try {
            return Optional.of(serializer.decode(payload));
        } catch (CacheSerializationException e) {
            log.warn("{} holds an unreadable value for key: {}, treating as miss: {}", tier, cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void promoteToL1(String cacheKey, byte[] payload) {
        l1.set(cacheKey, payload, l1.getDefaultTtl());
        promotions.increment();
    }

    private void promoteToL2(String cacheKey, byte[] payload) {
        if (l2 == null) return;

        if (remoteSet(l2, cacheKey, payload, props.getL2().getTtl()) == TierResult.Status.OK) {
            promotions.increment();
        }
    }

    private void recordHit(CacheTier tier, String keyType, long start) {
        if (metrics != null) {
            metrics.recordHit(tier, keyType);
            metrics.recordDuration("get_total", tier, System.nanoTime() - start);
        }
    }

    private void remoteFailure(CacheTier tier, String operation, String cacheKey, Throwable error) {
        remoteErrors.increment();
        log.warn("{} cache {} error for key {}: {}", tier, operation, cacheKey, error.getMessage());
    }

    private void rememberInvalidation(String fullPattern) {
        synchronized (recentInvalidations) {
            recentInvalidations.remove(fullPattern);
            recentInvalidations.add(fullPattern);

            Iterator<String> oldest = recentInvalidations.iterator();
            while (recentInvalidations.size() > RECENT_INVALIDATIONS_LIMIT && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }

    private TieredCacheStats.Remote remoteStats(CacheTier tier, RemoteTierClient client) {
        if (client == null) return TieredCacheStats.Remote.disabled(tier);

        TierResult<Properties> info = client.info();

        if (info.isError()) return TieredCacheStats.Remote.error(tier, info.error().getMessage());

        TierResult<Long> keysCount = client.scan(keys.allKeysPattern(), props.getBatchInvalidationSize(), batch -> {
        });

        if (keysCount.isError()) return TieredCacheStats.Remote.error(tier, keysCount.error().getMessage());

        Properties values = info.value();
        long usedMemory = longValue(values, "used_memory");

        if (metrics != null) metrics.recordMemoryUsage(tier, usedMemory);

        return new TieredCacheStats.Remote(tier, TieredCacheStats.RemoteStatus.CONNECTED,
                usedMemory,
                longValue(values, "used_memory_peak"),
                keysCount.value(),
                longValue(values, "connected_clients"),
                longValue(values, "instantaneous_ops_per_sec"),
                null);
    }

    private List<RemoteTierClient> remoteClients() {
        List<RemoteTierClient> clients = new ArrayList<>(2);

        if (l2 != null) clients.add(l2);
        if (l3 != null) clients.add(l3);

        return clients;
    }

    private static long longValue(Properties properties, String name) {
        String value = properties.getProperty(name);

        if (value == null) return 0L;

        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
