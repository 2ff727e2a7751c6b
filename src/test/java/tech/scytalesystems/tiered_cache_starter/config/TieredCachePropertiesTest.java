package tech.scytalesystems.tiered_cache_starter.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1050h
 */
@DisplayName("TieredCacheProperties Tests")
class TieredCachePropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("Should have correct default values")
    void testDefaults() {
        TieredCacheProperties props = new TieredCacheProperties();

        assertTrue(props.isEnabled());
        assertEquals("app", props.getKeyPrefix());
        assertEquals(List.of("user", "event", "product", "query"), props.getKeyCategories());
        assertTrue(props.isCompressionEnabled());
        assertEquals(3, props.getCompressionLevel());
        assertTrue(props.isMetricsEnabled());
        assertEquals(1000, props.getBatchInvalidationSize());
        assertEquals(DataSize.ofMegabytes(1), props.getMaxValueSize());

        assertEquals(10_000, props.getLocal().getMaxSize());
        assertEquals(Duration.ofMinutes(5), props.getLocal().getTtl());
        assertEquals(1024, props.getLocal().getCompressionThreshold());

        assertTrue(props.getL2().isEnabled());
        assertEquals("127.0.0.1", props.getL2().getHost());
        assertEquals(6379, props.getL2().getPort());
        assertEquals(0, props.getL2().getDatabase());
        assertEquals(Duration.ofMinutes(30), props.getL2().getTtl());
        assertEquals(100, props.getL2().getMaxConnections());
        assertEquals(Duration.ofMillis(500), props.getL2().getTimeout());

        assertEquals(1, props.getL3().getDatabase());
        assertEquals(Duration.ofHours(1), props.getL3().getTtl());
        assertEquals(50, props.getL3().getMaxConnections());
    }

    @Test
    @DisplayName("Should allow setting all properties")
    void testSetters() {
        TieredCacheProperties props = new TieredCacheProperties();

        props.setEnabled(false);
        props.setKeyPrefix("events-app");
        props.setKeyCategories(List.of("ticket"));
        props.setCompressionEnabled(false);
        props.setCompressionLevel(9);
        props.setMetricsEnabled(false);
        props.setBatchInvalidationSize(250);
        props.setMaxValueSize(DataSize.ofKilobytes(512));
        props.getLocal().setMaxSize(500);
        props.getLocal().setTtl(Duration.ofMinutes(1));
        props.getLocal().setCompressionThreshold(2048);
        props.getL3().setEnabled(false);
        props.getL3().setHost("redis-eu.internal");
        props.getL3().setPort(6380);
        props.getL3().setDatabase(4);
        props.getL3().setTtl(Duration.ofHours(6));
        props.getL3().setMaxConnections(20);
        props.getL3().setTimeout(Duration.ofSeconds(2));

        assertFalse(props.isEnabled());
        assertEquals("events-app", props.getKeyPrefix());
        assertEquals(List.of("ticket"), props.getKeyCategories());
        assertFalse(props.isCompressionEnabled());
        assertEquals(9, props.getCompressionLevel());
        assertFalse(props.isMetricsEnabled());
        assertEquals(250, props.getBatchInvalidationSize());
        assertEquals(DataSize.ofKilobytes(512), props.getMaxValueSize());
        assertEquals(500, props.getLocal().getMaxSize());
        assertEquals(Duration.ofMinutes(1), props.getLocal().getTtl());
        assertEquals(2048, props.getLocal().getCompressionThreshold());
        assertFalse(props.getL3().isEnabled());
        assertEquals("redis-eu.internal", props.getL3().getHost());
        assertEquals(6380, props.getL3().getPort());
        assertEquals(4, props.getL3().getDatabase());
        assertEquals(Duration.ofHours(6), props.getL3().getTtl());
        assertEquals(20, props.getL3().getMaxConnections());
        assertEquals(Duration.ofSeconds(2), props.getL3().getTimeout());
    }

    @Test
    @DisplayName("Should accept the defaults")
    void testDefaultsAreValid() {
        assertTrue(validator.validate(new TieredCacheProperties()).isEmpty());
    }

    @Test
    @DisplayName("Should reject out of range values, including nested tiers")
    void testValidation() {
        TieredCacheProperties props = new TieredCacheProperties();
        props.setCompressionLevel(12);
        props.setKeyPrefix(" ");
        props.getLocal().setMaxSize(0);
        props.getL2().setPort(0);

        Set<ConstraintViolation<TieredCacheProperties>> violations = validator.validate(props);

        assertEquals(4, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("local.maxSize")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("l2.port")));
    }

    @Test
    @DisplayName("Should reject zero or negative durations")
    void testNonPositiveDurations() {
        TieredCacheProperties props = new TieredCacheProperties();
        props.getLocal().setTtl(Duration.ZERO);
        props.getL2().setTtl(Duration.ofSeconds(-1));
        props.getL3().setTimeout(Duration.ZERO);

        Set<ConstraintViolation<TieredCacheProperties>> violations = validator.validate(props);

        assertEquals(3, violations.size());
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("local.ttlPositive")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("l2.ttlPositive")));
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals("l3.timeoutPositive")));
    }
}
