package tech.scytalesystems.tiered_cache_starter.config;

import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.endpoint.TieredCacheEndpoint;

/**
 * @author Gathariki Ngigi
 * Created on 26/11/2025
 * Time 1110h
 * Auto-configuration for the tiered-cache Spring Boot Actuator endpoint.
 * <p>
 * This configuration registers the endpoint when:
 * 1. Spring Boot Actuator is on the classpath
 * 2. A TieredCacheManager bean exists
 * 3. The endpoint is enabled and exposed in configuration
 * 4. No custom TieredCacheEndpoint bean is already defined
 */
@AutoConfiguration(after = TieredCacheAutoConfiguration.class)
@ConditionalOnClass(name = {
        "org.springframework.boot.actuate.endpoint.annotation.Endpoint",
        "org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint"
})
@SuppressWarnings("unused")
public class TieredCacheEndpointConfiguration {
    /**
     * The endpoint will be registered at /actuator/tiered-cache
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TieredCacheManager.class)
    @ConditionalOnAvailableEndpoint
    public TieredCacheEndpoint tieredCacheEndpoint(TieredCacheManager tieredCacheManager) {
        return new TieredCacheEndpoint(tieredCacheManager);
    }
}
