package com.stage.composition.cache;

/**
 * Counters of a {@link LayerParseCache}.
 *
 * @param hits         lookups answered from a cached parse tree
 * @param misses       lookups that had to parse the layer text
 * @param evictions    parse trees dropped for size or expiry
 * @param cachedLayers distinct layer texts currently held
 */
public record ParseCacheStats(long hits, long misses, long evictions, long cachedLayers) {

    public long lookups() {
        return hits + misses;
    }

    /**
     * Share of lookups that skipped parsing, 0.0 when nothing was looked up yet.
     */
    public double hitRate() {
        long lookups = lookups();
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public static ParseCacheStats none() {
        return new ParseCacheStats(0, 0, 0, 0);
    }
}
