package com.stage.composition.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed parse cache. Stored trees are private copies; every read returns a fresh
 * deep copy so composed results never alias cached prims.
 */
public class CaffeineLayerParseCache implements LayerParseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLayerParseCache.class);

    private final Cache<String, List<Prim>> cache;

    public CaffeineLayerParseCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxLayers())
                .expireAfterAccess(config.expireAfterAccess())
                .recordStats()
                .build();
        log.info("cache.initialized maxLayers={} expireAfterAccess={}",
                config.maxLayers(), config.expireAfterAccess());
    }

    /**
     * Creates the cache described by the configuration: Caffeine when enabled, no-op otherwise.
     */
    public static LayerParseCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineLayerParseCache(config) : new NoOpLayerParseCache();
    }

    @Override
    public Optional<List<Prim>> get(String text) {
        List<Prim> roots = cache.getIfPresent(text);
        return roots == null ? Optional.empty() : Optional.of(PrimTree.deepCopy(roots));
    }

    @Override
    public void put(String text, List<Prim> roots) {
        cache.put(text, List.copyOf(PrimTree.deepCopy(roots)));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated all");
    }

    @Override
    public ParseCacheStats getStats() {
        CacheStats stats = cache.stats();
        return new ParseCacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                cache.estimatedSize());
    }
}
