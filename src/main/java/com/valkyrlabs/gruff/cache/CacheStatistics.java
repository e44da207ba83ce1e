package com.valkyrlabs.gruff.cache;

/**
 * Snapshot of hit/miss counts for a {@link GruffCache}.
 */
public class CacheStatistics {

    private final long hits;
    private final long misses;

    public CacheStatistics(long hits, long misses) {
        this.hits = hits;
        this.misses = misses;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /** Hits over lookups, 0 when nothing was looked up. */
    public double getHitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0d;
    }

    @Override
    public String toString() {
        return "CacheStatistics[hits=" + hits + ", misses=" + misses + ", hitRate=" + getHitRate() + "]";
    }
}
