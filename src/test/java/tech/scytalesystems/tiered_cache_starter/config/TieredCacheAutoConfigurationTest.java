package tech.scytalesystems.tiered_cache_starter.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.scytalesystems.tiered_cache_starter.aside.CacheAsideTemplate;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.cache.TieredSpringCacheManager;
import tech.scytalesystems.tiered_cache_starter.metrics.TieredCacheMetrics;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 1830h
 */
@DisplayName("TieredCacheAutoConfiguration Tests")
class TieredCacheAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TieredCacheAutoConfiguration.class))
            .withPropertyValues(
                    "app.cache.tiered.l2.enabled=false",
                    "app.cache.tiered.l3.enabled=false");

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfiguration {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomCacheManagerConfiguration {
        @Bean
        CacheManager cacheManager() {
            return new ConcurrentMapCacheManager();
        }
    }

    @Test
    @DisplayName("Should create the tiered cache beans")
    void testBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(TieredCacheManager.class));
            assertNotNull(context.getBean(CacheAsideTemplate.class));
            assertInstanceOf(TieredSpringCacheManager.class, context.getBean(CacheManager.class));
            assertTrue(context.getBean(TieredCacheManager.class).isInitialized());
            assertTrue(context.getBeansOfType(TieredCacheMetrics.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should bind properties")
    void testProperties() {
        contextRunner
                .withPropertyValues(
                        "app.cache.tiered.key-prefix=events",
                        "app.cache.tiered.local.max-size=250",
                        "app.cache.tiered.local.ttl=2m")
                .run(context -> {
                    TieredCacheProperties props = context.getBean(TieredCacheProperties.class);

                    assertEquals("events", props.getKeyPrefix());
                    assertEquals(250, props.getLocal().getMaxSize());
                    assertEquals(Duration.ofMinutes(2), props.getLocal().getTtl());
                    assertEquals(250, context.getBean(TieredCacheManager.class).getL1Store().getMaxSize());
                });
    }

    @Test
    @DisplayName("Should fail startup on invalid properties")
    void testInvalidProperties() {
        contextRunner
                .withPropertyValues("app.cache.tiered.compression-level=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should fail startup on a zero L1 TTL")
    void testZeroLocalTtl() {
        contextRunner
                .withPropertyValues("app.cache.tiered.local.ttl=0s")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should wire metrics when a MeterRegistry exists")
    void testMetrics() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class)
                .run(context -> {
                    assertEquals(1, context.getBeansOfType(TieredCacheMetrics.class).size());

                    TieredCacheManager cacheManager = context.getBean(TieredCacheManager.class);
                    cacheManager.set("user:1", "Ana", null, null);
                    cacheManager.get("user:1", null);

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.get("cache.hits").tag("tier", "L1").counter().count());
                });
    }

    @Test
    @DisplayName("Should skip metrics when disabled")
    void testMetricsDisabled() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class)
                .withPropertyValues("app.cache.tiered.metrics-enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(TieredCacheMetrics.class).isEmpty()));
    }

    @Test
    @DisplayName("Should keep an application CacheManager")
    void testExistingCacheManager() {
        contextRunner
                .withUserConfiguration(CustomCacheManagerConfiguration.class)
                .run(context -> {
                    assertInstanceOf(ConcurrentMapCacheManager.class, context.getBean(CacheManager.class));
                    assertNotNull(context.getBean(TieredCacheManager.class));
                });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void testDisabled() {
        contextRunner
                .withPropertyValues("app.cache.tiered.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(TieredCacheManager.class).isEmpty()));
    }
}
