package tech.scytalesystems.tiered_cache_starter.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.RedisTemplate;
import tech.scytalesystems.tiered_cache_starter.aside.CacheAsideTemplate;
import tech.scytalesystems.tiered_cache_starter.cache.CacheTier;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.cache.TieredSpringCacheManager;
import tech.scytalesystems.tiered_cache_starter.metrics.MicrometerTieredCacheMetrics;
import tech.scytalesystems.tiered_cache_starter.metrics.TieredCacheMetrics;
import tech.scytalesystems.tiered_cache_starter.remote.RedisTierClient;
import tech.scytalesystems.tiered_cache_starter.remote.RemoteTierClient;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 1020h
 * <p>Spring Boot AutoConfiguration that:
 * <p>- Builds the {@link TieredCacheManager} with its own L2 and L3 Redis connection pools
 * <p>- Wires Micrometer metrics when a {@link MeterRegistry} is available
 * <p>- Exposes the lookup-or-compute {@link CacheAsideTemplate}
 * <p>- Provides a Spring {@link CacheManager} over the tiers when the application has none
 * <p>This configuration is activated when:
 * <p>1. Spring Data Redis is on the classpath
 * <p>2. app.cache.tiered.enabled=true (default)
 * <p>The manager pings every enabled remote tier on startup and fails the context if one is unreachable.
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(RedisTemplate.class)
@ConditionalOnProperty(prefix = "app.cache.tiered", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TieredCacheProperties.class)
@SuppressWarnings("unused")
public class TieredCacheAutoConfiguration {
    /**
     * Creates Micrometer metrics when metrics are enabled and a registry exists.
     */
    @Bean
    @ConditionalOnMissingBean(TieredCacheMetrics.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "app.cache.tiered", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public TieredCacheMetrics tieredCacheMetrics(MeterRegistry meterRegistry) {
        return new MicrometerTieredCacheMetrics(meterRegistry);
    }

    /**
     * Creates the tiered cache manager.
     * <p>
     * Cache flow:
     * - Read: L1 → L2 → L3 (promotes to faster tiers on a slower hit)
     * - Write: every tier, each with its own TTL
     * - Evict: every tier
     * <p>
     * A disabled remote tier gets no client and is skipped.
     */
    @Bean(initMethod = "initialize", destroyMethod = "close")
    @ConditionalOnMissingBean
    public TieredCacheManager tieredCacheManager(TieredCacheProperties props,
                                                 ObjectProvider<TieredCacheMetrics> metrics) {
        RemoteTierClient l2 = props.getL2().isEnabled() ? RedisTierClient.create(CacheTier.L2, props.getL2()) : null;
        RemoteTierClient l3 = props.getL3().isEnabled() ? RedisTierClient.create(CacheTier.L3, props.getL3()) : null;

        TieredCacheManager cacheManager = new TieredCacheManager(props, l2, l3);
        metrics.ifAvailable(cacheManager::setMetrics);

        return cacheManager;
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheAsideTemplate cacheAsideTemplate(TieredCacheManager tieredCacheManager) {
        return new CacheAsideTemplate(tieredCacheManager);
    }

    /**
     * Spring Cache view of the tiers, one namespace per cache name.
     */
    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    public CacheManager cacheManager(TieredCacheManager tieredCacheManager) {
        return new TieredSpringCacheManager(tieredCacheManager, null);
    }
}
