package tech.scytalesystems.tiered_cache_starter.cache;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 0914h
 * <p>The three layers of the cache hierarchy, fastest first.
 * <p>- L1: in-process bounded store
 * <p>- L2: local (fast) Redis
 * <p>- L3: distant (larger) Redis
 */
public enum CacheTier {
    L1,
    L2,
    L3;

    /**
     * Label used for logs and metric tags.
     */
    public String label() {
        return name();
    }
}
