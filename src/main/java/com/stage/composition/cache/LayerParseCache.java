package com.stage.composition.cache;

import com.stage.composition.core.model.Prim;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Cache of parsed prim trees keyed by the exact layer text.
 * Implementations hand out deep copies, so callers may mutate what they get.
 */
public interface LayerParseCache {

    /**
     * Gets the cached roots parsed from this text.
     *
     * @return a deep copy of the cached roots, or empty if not cached
     */
    Optional<List<Prim>> get(String text);

    /**
     * Caches the roots parsed from this text.
     */
    void put(String text, List<Prim> roots);

    /**
     * Returns the cached roots for this text, parsing and caching them on a miss.
     * Exceptions thrown by the parser propagate and nothing is cached.
     */
    default List<Prim> getOrParse(String text, Function<String, List<Prim>> parser) {
        Optional<List<Prim>> cached = get(text);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<Prim> roots = parser.apply(text);
        put(text, roots);
        return roots;
    }

    void invalidateAll();

    ParseCacheStats getStats();
}
