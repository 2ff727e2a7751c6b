package tech.scytalesystems.tiered_cache_starter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1030h
 * <p>
 * Configuration properties for the tiered cache starter.
 * These properties are validated on application startup and are read once,
 * when the {@code TieredCacheManager} is built.
 */
@Validated
@ConfigurationProperties("app.cache.tiered")
@SuppressWarnings("unused")
public class TieredCacheProperties {

    /**
     * Whether to enable the tiered cache auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Application prefix of every cache key: {@code <prefix>:<namespace>:<key>}.
     */
    @NotBlank(message = "Key prefix cannot be blank")
    private String keyPrefix = "app";

    /**
     * Logical key prefixes reported as their own {@code key_type} in metrics. Anything else is "other".
     */
    @NotNull
    private List<String> keyCategories = new ArrayList<>(List.of("user", "event", "product", "query"));

    /**
     * Whether values larger than the compression threshold are GZIP compressed.
     */
    private boolean compressionEnabled = true;

    /**
     * Deflate level used when compressing, 1 (fastest) to 9 (smallest).
     */
    @Min(value = 1, message = "Compression level must be at least 1")
    @Max(value = 9, message = "Compression level must be at most 9")
    private int compressionLevel = 3;

    /**
     * Whether hit/miss/eviction/duration metrics are published to Micrometer.
     */
    private boolean metricsEnabled = true;

    /**
     * Number of keys requested per SCAN round trip and deleted per batch during pattern invalidation.
     */
    @Min(value = 1, message = "Batch invalidation size must be at least 1")
    private int batchInvalidationSize = 1000;

    /**
     * Largest encoded value accepted by {@code set}; bigger values are rejected, never truncated.
     */
    @NotNull(message = "Max value size cannot be null")
    private DataSize maxValueSize = DataSize.ofMegabytes(1);

    @Valid
    private final Local local = new Local();

    @Valid
    private final Remote l2 = new Remote(0, Duration.ofMinutes(30), 100);

    @Valid
    private final Remote l3 = new Remote(1, Duration.ofHours(1), 50);

    // GETTERS
    public boolean isEnabled() {
        return this.enabled;
    }

    public String getKeyPrefix() {
        return this.keyPrefix;
    }

    public List<String> getKeyCategories() {
        return this.keyCategories;
    }

    public boolean isCompressionEnabled() {
        return this.compressionEnabled;
    }

    public int getCompressionLevel() {
        return this.compressionLevel;
    }

    public boolean isMetricsEnabled() {
        return this.metricsEnabled;
    }

    public int getBatchInvalidationSize() {
        return this.batchInvalidationSize;
    }

    public DataSize getMaxValueSize() {
        return this.maxValueSize;
    }

    public Local getLocal() {
        return this.local;
    }

    public Remote getL2() {
        return this.l2;
    }

    public Remote getL3() {
        return this.l3;
    }

    // SETTERS
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public void setKeyCategories(List<String> keyCategories) {
        this.keyCategories = keyCategories;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public void setCompressionLevel(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    public void setMetricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }

    public void setBatchInvalidationSize(int batchInvalidationSize) {
        this.batchInvalidationSize = batchInvalidationSize;
    }

    public void setMaxValueSize(DataSize maxValueSize) {
        this.maxValueSize = maxValueSize;
    }

    // Null is reported by @NotNull
    private static boolean isPositive(Duration duration) {
        return duration == null || (!duration.isZero() && !duration.isNegative());
    }

    /**
     * The in-process (L1) tier.
     */
    public static class Local {

        /**
         * The maximum number of entries in the L1 store.
         */
        @Min(value = 1, message = "L1 max size must be at least 1")
        private int maxSize = 10_000;

        /**
         * Default Time-To-Live for L1 entries, also used when promoting from L2/L3.
         */
        @NotNull(message = "L1 TTL cannot be null")
        private Duration ttl = Duration.ofMinutes(5);

        /**
         * Payloads larger than this many bytes are candidates for compression.
         */
        @Min(value = 0, message = "Compression threshold cannot be negative")
        private int compressionThreshold = 1024;

        public int getMaxSize() {
            return maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public int getCompressionThreshold() {
            return compressionThreshold;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public void setCompressionThreshold(int compressionThreshold) {
            this.compressionThreshold = compressionThreshold;
        }

        @AssertTrue(message = "L1 TTL must be positive")
        public boolean isTtlPositive() {
            return isPositive(ttl);
        }
    }

    /**
     * A Redis backed tier (L2 or L3).
     */
    public static class Remote {

        /**
         * Whether this tier is used at all. A disabled tier is skipped on reads and writes.
         */
        private boolean enabled = true;

        @NotBlank(message = "Redis host cannot be blank")
        private String host = "127.0.0.1";

        @Min(value = 1, message = "Redis port must be positive")
        @Max(value = 65535, message = "Redis port must be at most 65535")
        private int port = 6379;

        @Min(value = 0, message = "Redis database index cannot be negative")
        private int database;

        /**
         * Default Time-To-Live for entries written to this tier.
         */
        @NotNull(message = "Remote TTL cannot be null")
        private Duration ttl;

        /**
         * Maximum number of pooled connections to this tier.
         */
        @Min(value = 1, message = "Max connections must be at least 1")
        private int maxConnections;

        /**
         * Upper bound for a single command; a timed out command counts as a miss.
         */
        @NotNull(message = "Remote timeout cannot be null")
        private Duration timeout = Duration.ofMillis(500);

        public Remote() {
            this(0, Duration.ofMinutes(30), 100);
        }

        Remote(int database, Duration ttl, int maxConnections) {
            this.database = database;
            this.ttl = ttl;
            this.maxConnections = maxConnections;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public String getHost() {
            return host;
        }

        public int getPort() {
            return port;
        }

        public int getDatabase() {
            return database;
        }

        public Duration getTtl() {
            return ttl;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        @AssertTrue(message = "Remote TTL must be positive")
        public boolean isTtlPositive() {
            return isPositive(ttl);
        }

        @AssertTrue(message = "Remote timeout must be positive")
        public boolean isTimeoutPositive() {
            return isPositive(timeout);
        }
    }
}
