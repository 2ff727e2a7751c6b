package tech.scytalesystems.tiered_cache_starter.remote;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulConnection;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.RedisSerializer;
import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 0955h
 * <p>{@link RemoteTierClient} on top of Spring Data Redis and a pooled Lettuce connection.
 *
 * <p>Keys are plain strings, values raw bytes: the payload is already encoded (and possibly
 * compressed) by the {@code ValueSerializer}, so no Redis serializer touches it again.
 *
 * <p>Every command is bounded by the tier's configured timeout. A timeout, a refused connection
 * or an exhausted pool come back as {@link TierResult#error(Throwable)}.
 */
public class RedisTierClient implements RemoteTierClient {
    private static final Logger log = LoggerFactory.getLogger(RedisTierClient.class);

    private final CacheTier tier;
    private final RedisTemplate<String, byte[]> redisTemplate;
    private final LettuceConnectionFactory connectionFactory;

    /**
     * Wraps an existing template. The caller owns the template's connection factory.
     */
    public RedisTierClient(CacheTier tier, RedisTemplate<String, byte[]> redisTemplate) {
        this(tier, redisTemplate, null);
    }

    private RedisTierClient(CacheTier tier, RedisTemplate<String, byte[]> redisTemplate,
                            LettuceConnectionFactory connectionFactory) {
        this.tier = tier;
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
    }

    /**
     * Builds a client with its own connection pool from the tier's properties.
     * No connection is opened until the first command.
     */
    public static RedisTierClient create(CacheTier tier, TieredCacheProperties.Remote props) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(props.getHost(), props.getPort());
        standalone.setDatabase(props.getDatabase());

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfiguration(props));
        factory.afterPropertiesSet();
        factory.start();

        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(factory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();

        log.info("{} Redis client created - {}:{} db={}, maxConnections={}, timeout={}",
                tier, props.getHost(), props.getPort(), props.getDatabase(),
                props.getMaxConnections(), props.getTimeout());

        return new RedisTierClient(tier, template, factory);
    }

    static LettuceClientConfiguration clientConfiguration(TieredCacheProperties.Remote props) {
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(props.getMaxConnections());
        poolConfig.setMaxIdle(props.getMaxConnections());
        poolConfig.setMinIdle(0);
        // Pool exhaustion fails after the same bound as a command
        poolConfig.setMaxWait(props.getTimeout());

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(props.getTimeout())
                        .keepAlive(true)
                        .build())
                .build();

        return LettucePoolingClientConfiguration.builder()
                .poolConfig(poolConfig)
                .commandTimeout(props.getTimeout())
                .clientOptions(clientOptions)
                .build();
    }

    @Override
    public CacheTier tier() {
        return tier;
    }

    @Override
    public TierResult<String> ping() {
        return call("ping", null, () -> TierResult.ok(redisTemplate.execute((RedisCallback<String>) RedisConnection::ping)));
    }

    @Override
    public TierResult<byte[]> get(String key) {
        return call("get", key, () -> {
            byte[] value = redisTemplate.opsForValue().get(key);

            return value != null ? TierResult.ok(value) : TierResult.miss();
        });
    }

    @Override
    public TierResult<Void> set(String key, byte[] value, Duration ttl) {
        return call("set", key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);

            return TierResult.ok(null);
        });
    }

    @Override
    public TierResult<Long> delete(Collection<String> keys) {
        if (keys.isEmpty()) return TierResult.ok(0L);

        return call("delete", keys.size() == 1 ? keys.iterator().next() : keys.size() + " keys", () -> {
            Long deleted = redisTemplate.delete(keys);

            return TierResult.ok(deleted != null ? deleted : 0L);
        });
    }

    @Override
    public TierResult<Long> scan(String pattern, int batchSize, Consumer<List<String>> batchConsumer) {
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be at least 1");

        return call("scan", pattern, () -> {
            Long total = redisTemplate.execute((RedisCallback<Long>) connection -> {
                ScanOptions options = ScanOptions.scanOptions()
                        .match(pattern)
                        .count(batchSize)
                        .build();

                long count = 0;
                List<String> batch = new ArrayList<>(batchSize);

                try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                    while (cursor.hasNext()) {
                        batch.add(new String(cursor.next(), StandardCharsets.UTF_8));

                        if (batch.size() >= batchSize) {
                            batchConsumer.accept(List.copyOf(batch));
                            count += batch.size();
                            batch.clear();
                        }
                    }
                }

                if (!batch.isEmpty()) {
                    batchConsumer.accept(List.copyOf(batch));
                    count += batch.size();
                }

                return count;
            });

            return TierResult.ok(total != null ? total : 0L);
        });
    }

    @Override
    public TierResult<Properties> info() {
        return call("info", null, () -> {
            Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());

            return TierResult.ok(info != null ? info : new Properties());
        });
    }

    @Override
    public void close() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
            log.info("{} Redis connections closed", tier);
        }
    }

    private <T> TierResult<T> call(String operation, String key, Supplier<TierResult<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.debug("{} {} failed for key: {}, error: {}", tier, operation, key, e.getMessage());

            return TierResult.error(e);
        }
    }
}
