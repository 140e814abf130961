package com.stage.composition.cache;

import com.stage.composition.core.model.Prim;

import java.util.List;
import java.util.Optional;

/**
 * Holds nothing, so every layer is parsed again on each lookup. Chosen when the parse cache
 * is disabled.
 */
public class NoOpLayerParseCache implements LayerParseCache {

    @Override
    public Optional<List<Prim>> get(String text) {
        return Optional.empty();
    }

    @Override
    public void put(String text, List<Prim> roots) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public ParseCacheStats getStats() {
        return ParseCacheStats.none();
    }
}
