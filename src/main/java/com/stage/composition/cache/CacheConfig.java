package com.stage.composition.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the layer parse cache.
 *
 * @param maxLayers         parse trees kept at most, one per distinct layer text
 * @param expireAfterAccess how long an unused parse tree stays cached
 * @param enabled           false to parse every layer on every lookup
 */
public record CacheConfig(int maxLayers, Duration expireAfterAccess, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(expireAfterAccess, "expireAfterAccess is required");
        if (maxLayers <= 0) {
            throw new IllegalArgumentException("maxLayers must be > 0");
        }
        if (expireAfterAccess.isNegative() || expireAfterAccess.isZero()) {
            throw new IllegalArgumentException("expireAfterAccess must be positive");
        }
    }

    /**
     * 256 layer texts, dropped after ten minutes without access.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(256, Duration.ofMinutes(10), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
