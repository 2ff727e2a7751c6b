package tech.scytalesystems.tiered_cache_starter.cache;

import java.util.List;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 0850h
 * <p>Snapshot returned by {@link TieredCacheManager#getStats()}.
 */
public record TieredCacheStats(Overall overall, Local l1, Remote l2, Remote l3, List<String> recentInvalidations) {

    /**
     * Counters of the whole hierarchy. A promotion is one copy into a faster tier.
     */
    public record Overall(long totalRequests,
                          double hitRatePercent,
                          long l1Hits,
                          long l2Hits,
                          long l3Hits,
                          long misses,
                          long promotions,
                          long remoteErrors) {
    }

    public record Local(int size,
                        int maxSize,
                        double utilizationPercent,
                        long memoryUsageBytes,
                        double hitRatePercent,
                        long hits,
                        long misses,
                        double averageEntrySize,
                        long lruEvictions,
                        long expiredEvictions) {
    }

    /**
     * Telemetry of a Redis tier as reported by {@code INFO}, plus the number of keys under the app prefix.
     */
    public record Remote(CacheTier tier,
                         RemoteStatus status,
                         long memoryUsageBytes,
                         long memoryPeakBytes,
                         long keysCount,
                         long connectedClients,
                         long opsPerSec,
                         String error) {

        public static Remote disabled(CacheTier tier) {
            return new Remote(tier, RemoteStatus.DISABLED, 0, 0, 0, 0, 0, null);
        }

        public static Remote error(CacheTier tier, String error) {
            return new Remote(tier, RemoteStatus.ERROR, 0, 0, 0, 0, 0, error);
        }
    }

    public enum RemoteStatus {
        CONNECTED,
        DISABLED,
        ERROR
    }
}
