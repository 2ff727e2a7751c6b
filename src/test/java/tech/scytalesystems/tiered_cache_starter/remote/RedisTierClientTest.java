package tech.scytalesystems.tiered_cache_starter.remote;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 1745h
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisTierClient Tests")
class RedisTierClientTest {

    @Mock
    private RedisTemplate<String, byte[]> redisTemplate;

    @Mock
    private ValueOperations<String, byte[]> valueOperations;

    private RedisTierClient client;

    @BeforeEach
    void setUp() {
        client = new RedisTierClient(CacheTier.L2, redisTemplate);
    }

    @Test
    @DisplayName("Should return the stored payload")
    void testGetHit() {
        byte[] payload = {0x00, '"', 'v', '"'};
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("app:ns:k")).thenReturn(payload);

        TierResult<byte[]> result = client.get("app:ns:k");

        assertTrue(result.isOk());
        assertArrayEquals(payload, result.value());
    }

    @Test
    @DisplayName("Should report a miss for an absent key")
    void testGetMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("app:ns:k")).thenReturn(null);

        assertTrue(client.get("app:ns:k").isMiss());
    }

    @Test
    @DisplayName("Should turn driver exceptions into errors")
    void testGetError() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("app:ns:k")).thenThrow(new QueryTimeoutException("Redis command timed out"));

        TierResult<byte[]> result = client.get("app:ns:k");

        assertTrue(result.isError());
        assertInstanceOf(QueryTimeoutException.class, result.error());
    }

    @Test
    @DisplayName("Should write with TTL")
    void testSet() {
        byte[] payload = {0x00, '1'};
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertTrue(client.set("app:ns:k", payload, Duration.ofMinutes(30)).isOk());

        verify(valueOperations).set("app:ns:k", payload, Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("Should report a failed write")
    void testSetError() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOperations).set(any(), any(), any(Duration.class));

        assertTrue(client.set("app:ns:k", new byte[]{0x00, '1'}, Duration.ofMinutes(30)).isError());
    }

    @Test
    @DisplayName("Should delete keys and return the count")
    void testDelete() {
        List<String> keys = List.of("app:ns:a", "app:ns:b");
        when(redisTemplate.delete(keys)).thenReturn(2L);

        TierResult<Long> result = client.delete(keys);

        assertTrue(result.isOk());
        assertEquals(2L, result.value());
    }

    @Test
    @DisplayName("Should skip deleting an empty key list")
    void testDeleteEmpty() {
        assertEquals(0L, client.delete(List.of()).value());

        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Should answer ping")
    @SuppressWarnings("unchecked")
    void testPing() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn("PONG");

        TierResult<String> result = client.ping();

        assertTrue(result.isOk());
        assertEquals("PONG", result.value());
    }

    @Test
    @DisplayName("Should report an unreachable server on ping")
    @SuppressWarnings("unchecked")
    void testPingError() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertTrue(client.ping().isError());
    }

    @Test
    @DisplayName("Should return server info")
    @SuppressWarnings("unchecked")
    void testInfo() {
        Properties info = new Properties();
        info.setProperty("used_memory", "1024");
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn(info);

        assertEquals("1024", client.info().value().getProperty("used_memory"));
    }

    @Test
    @DisplayName("Should report scan failures without calling the consumer")
    @SuppressWarnings("unchecked")
    void testScanError() {
        List<List<String>> batches = new ArrayList<>();
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertTrue(client.scan("app:*", 100, batches::add).isError());
        assertTrue(batches.isEmpty());
    }

    @Test
    @DisplayName("Should reject a batch size below one")
    void testScanBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> client.scan("app:*", 0, batch -> {
        }));
    }

    @Test
    @DisplayName("Should not close a template it does not own")
    void testClose() {
        client.close();

        verifyNoInteractions(redisTemplate);
        assertEquals(CacheTier.L2, client.tier());
    }

    @Test
    @DisplayName("Should size the connection pool and timeouts from the tier properties")
    void testClientConfiguration() {
        TieredCacheProperties.Remote props = new TieredCacheProperties.Remote();
        props.setMaxConnections(20);
        props.setTimeout(Duration.ofSeconds(2));

        LettuceClientConfiguration configuration = RedisTierClient.clientConfiguration(props);

        LettucePoolingClientConfiguration pooling = assertInstanceOf(LettucePoolingClientConfiguration.class, configuration);
        assertEquals(20, pooling.getPoolConfig().getMaxTotal());
        assertEquals(20, pooling.getPoolConfig().getMaxIdle());
        assertEquals(Duration.ofSeconds(2), pooling.getPoolConfig().getMaxWaitDuration());
        assertEquals(Duration.ofSeconds(2), configuration.getCommandTimeout());
    }
}
