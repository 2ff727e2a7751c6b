package tech.scytalesystems.tiered_cache_starter.cache;

import tech.scytalesystems.tiered_cache_starter.remote.TierResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1410h
 * <p>Outcome of {@link TieredCacheManager#write}.
 *
 * @param tiers     status of every tier that was written; disabled tiers are absent
 * @param rejection why nothing was written at all, or null
 */
public record WriteResult(Map<CacheTier, TierResult.Status> tiers, Rejection rejection) {

    public enum Rejection {
        SERIALIZATION_FAILED,
        VALUE_TOO_LARGE
    }

    public WriteResult {
        tiers = tiers.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(tiers));
    }

    static WriteResult rejected(Rejection rejection) {
        return new WriteResult(Collections.emptyMap(), rejection);
    }

    /**
     * True when the value was accepted and every requested tier stored it.
     */
    public boolean success() {
        return rejection == null && !tiers.containsValue(TierResult.Status.ERROR);
    }
}
