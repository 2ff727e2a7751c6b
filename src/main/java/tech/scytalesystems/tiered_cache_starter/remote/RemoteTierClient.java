package tech.scytalesystems.tiered_cache_starter.remote;

import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 0925h
 * <p>Thin adapter over a remote key-value store used as the L2 or L3 tier.
 *
 * <p>Implementations are safe for concurrent use, bound every call with a timeout, and report
 * failures through {@link TierResult#error(Throwable)} instead of throwing.
 */
public interface RemoteTierClient extends AutoCloseable {

    CacheTier tier();

    /**
     * Checks the connection. Used once by {@code TieredCacheManager#initialize()}.
     */
    TierResult<String> ping();

    /**
     * {@code GET key}
     */
    TierResult<byte[]> get(String key);

    /**
     * {@code SETEX key ttl value}
     */
    TierResult<Void> set(String key, byte[] value, Duration ttl);

    /**
     * {@code DEL key...}
     *
     * @return number of keys that existed
     */
    TierResult<Long> delete(Collection<String> keys);

    /**
     * Walks {@code SCAN cursor MATCH pattern COUNT batchSize} until the cursor is exhausted,
     * handing matched keys to {@code batchConsumer} in batches of at most {@code batchSize}.
     *
     * @return number of keys handed to the consumer
     */
    TierResult<Long> scan(String pattern, int batchSize, Consumer<List<String>> batchConsumer);

    /**
     * {@code INFO}
     */
    TierResult<Properties> info();

    /**
     * Releases the connection pool.
     */
    @Override
    void close();
}
