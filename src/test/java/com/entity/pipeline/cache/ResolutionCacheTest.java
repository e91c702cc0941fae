package com.entity.pipeline.cache;

import com.entity.pipeline.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCacheTest {

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void getAlwaysEmpty() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            cache.put("jeffrey epstein", EntityType.PERSON, 1L);

            assertTrue(cache.get("jeffrey epstein", EntityType.PERSON).isEmpty());
            assertEquals(0, cache.getStats().size());
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        private final CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());

        @Test
        @DisplayName("Should cache and retrieve entity ids")
        void putAndGet() {
            cache.put("jeffrey epstein", EntityType.PERSON, 1L);

            assertEquals(1L, cache.get("jeffrey epstein", EntityType.PERSON).orElseThrow());
            assertTrue(cache.get("ghislaine maxwell", EntityType.PERSON).isEmpty());
        }

        @Test
        @DisplayName("Should separate by entity type")
        void separateByType() {
            cache.put("maxwell", EntityType.PERSON, 1L);
            cache.put("maxwell", EntityType.ORGANIZATION, 2L);

            assertEquals(1L, cache.get("maxwell", EntityType.PERSON).orElseThrow());
            assertEquals(2L, cache.get("maxwell", EntityType.ORGANIZATION).orElseThrow());
        }

        @Test
        @DisplayName("Should invalidate every name resolving to an entity")
        void invalidateByEntityId() {
            cache.put("jeffrey epstein", EntityType.PERSON, 1L);
            cache.put("jeff epstein", EntityType.PERSON, 1L);
            cache.put("ghislaine maxwell", EntityType.PERSON, 2L);

            cache.invalidate(1L);

            assertTrue(cache.get("jeffrey epstein", EntityType.PERSON).isEmpty());
            assertTrue(cache.get("jeff epstein", EntityType.PERSON).isEmpty());
            assertTrue(cache.get("ghislaine maxwell", EntityType.PERSON).isPresent());
        }

        @Test
        @DisplayName("Should drop both merge endpoints")
        void onMergeInvalidatesBoth() {
            cache.put("jeffery epstein", EntityType.PERSON, 2L);
            cache.put("jeffrey epstein", EntityType.PERSON, 1L);

            cache.onMerge(2L, 1L);

            assertTrue(cache.get("jeffery epstein", EntityType.PERSON).isEmpty());
            assertTrue(cache.get("jeffrey epstein", EntityType.PERSON).isEmpty());
        }

        @Test
        @DisplayName("Should invalidate all entries")
        void invalidateAll() {
            cache.put("a name", EntityType.PERSON, 1L);
            cache.put("b name", EntityType.PERSON, 2L);

            cache.invalidateAll();

            assertTrue(cache.get("a name", EntityType.PERSON).isEmpty());
            assertTrue(cache.get("b name", EntityType.PERSON).isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void tracksStats() {
            cache.put("jeffrey epstein", EntityType.PERSON, 1L);
            cache.get("jeffrey epstein", EntityType.PERSON);
            cache.get("unknown", EntityType.PERSON);

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 1e-9);
        }
    }

    @Test
    void cacheConfig_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
    }
}
