package com.stage.composition.cache;

import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class LayerParseCacheTest {

    private static final String TEXT = "def \"A\" {}";

    private static List<Prim> roots() {
        return List.of(Prim.builder().path("/A").property("k", Property.of("k", "v")).build());
    }

    @Nested
    @DisplayName("CacheConfig")
    class CacheConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            CacheConfig config = CacheConfig.defaults();
            assertEquals(256, config.maxLayers());
            assertEquals(Duration.ofMinutes(10), config.expireAfterAccess());
            assertTrue(config.enabled());
            assertFalse(CacheConfig.disabled().enabled());
        }

        @Test
        @DisplayName("Should reject non-positive sizes and expiries")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofSeconds(10), true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ofSeconds(-1), true));
            assertThrows(NullPointerException.class, () -> new CacheConfig(10, null, true));
        }

        @Test
        @DisplayName("Should pick the implementation from the enabled flag")
        void testCreate() {
            assertInstanceOf(CaffeineLayerParseCache.class, CaffeineLayerParseCache.create(CacheConfig.defaults()));
            assertInstanceOf(NoOpLayerParseCache.class, CaffeineLayerParseCache.create(CacheConfig.disabled()));
        }
    }

    @Nested
    @DisplayName("NoOpLayerParseCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always miss and parse every time")
        void testAlwaysMisses() {
            NoOpLayerParseCache cache = new NoOpLayerParseCache();
            AtomicInteger parses = new AtomicInteger();
            Function<String, List<Prim>> parser = t -> {
                parses.incrementAndGet();
                return roots();
            };

            cache.put(TEXT, roots());
            assertTrue(cache.get(TEXT).isEmpty());
            cache.getOrParse(TEXT, parser);
            cache.getOrParse(TEXT, parser);

            assertEquals(2, parses.get());
            assertEquals(ParseCacheStats.none(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeineLayerParseCache")
    class CaffeineTests {

        private CaffeineLayerParseCache cache;

        @BeforeEach
        void setUp() {
            cache = new CaffeineLayerParseCache(new CacheConfig(10, Duration.ofMinutes(1), true));
        }

        @Test
        @DisplayName("Should parse once per distinct text")
        void testGetOrParse() {
            AtomicInteger parses = new AtomicInteger();
            Function<String, List<Prim>> parser = t -> {
                parses.incrementAndGet();
                return roots();
            };

            cache.getOrParse(TEXT, parser);
            cache.getOrParse(TEXT, parser);
            cache.getOrParse(TEXT + " ", parser);

            assertEquals(2, parses.get());
            ParseCacheStats stats = cache.getStats();
            assertEquals(1, stats.hits());
            assertEquals(2, stats.misses());
            assertEquals(3, stats.lookups());
            assertTrue(stats.hitRate() > 0.3);
        }

        @Test
        @DisplayName("Should hand out independent copies")
        void testCopiesAreIndependent() {
            cache.put(TEXT, roots());

            Prim first = cache.get(TEXT).orElseThrow().get(0);
            first.putProperty("k", Property.of("k", "mutated"));
            Prim second = cache.get(TEXT).orElseThrow().get(0);

            assertEquals("v", second.getPropertyText("k").orElseThrow());
            assertNotSame(first, second);
        }

        @Test
        @DisplayName("Should not cache when the parser fails")
        void testParserFailure() {
            assertThrows(IllegalStateException.class, () -> cache.getOrParse(TEXT, t -> {
                throw new IllegalStateException("boom");
            }));
            assertTrue(cache.get(TEXT).isEmpty());
        }

        @Test
        @DisplayName("Should invalidate all entries")
        void testInvalidateAll() {
            cache.put(TEXT, roots());
            cache.invalidateAll();

            assertTrue(cache.get(TEXT).isEmpty());
        }
    }
}
