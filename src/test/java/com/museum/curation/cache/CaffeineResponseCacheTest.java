package com.museum.curation.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.museum.curation.adapter.SourceRequest;
import com.museum.curation.adapter.SourceResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Response cache")
class CaffeineResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    @Nested
    @DisplayName("Caffeine")
    class CaffeineBacked {

        @Test
        @DisplayName("Hits and misses are counted")
        void stats() {
            CaffeineResponseCache cache = new CaffeineResponseCache(new CacheConfig(100, Duration.ofSeconds(60), true), ticker);
            cache.put("k", SourceResponse.empty());

            assertTrue(cache.get("k").isPresent());
            assertTrue(cache.get("other").isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Entries expire once the TTL has passed")
        void expiry() {
            CaffeineResponseCache cache = new CaffeineResponseCache(new CacheConfig(100, Duration.ofSeconds(60), true), ticker);
            cache.put("k", SourceResponse.empty());

            nanos.addAndGet(Duration.ofSeconds(59).toNanos());
            assertTrue(cache.get("k").isPresent());

            nanos.addAndGet(Duration.ofSeconds(2).toNanos());
            assertTrue(cache.get("k").isEmpty());
        }

        @Test
        @DisplayName("invalidateAll empties the cache")
        void invalidate() {
            CaffeineResponseCache cache = new CaffeineResponseCache(new CacheConfig(100, Duration.ofSeconds(60), true), ticker);
            cache.put("k", SourceResponse.empty());
            cache.invalidateAll();

            assertTrue(cache.get("k").isEmpty());
        }
    }

    @Test
    @DisplayName("A disabled config builds a cache that never stores")
    void disabled() {
        ResponseCache cache = CaffeineResponseCache.create(CacheConfig.disabled());
        cache.put("k", SourceResponse.empty());

        assertInstanceOf(NoOpResponseCache.class, cache);
        assertTrue(cache.get("k").isEmpty());
        assertEquals(CacheStats.empty(), cache.getStats());
        assertEquals(0.0, cache.getStats().hitRate());
    }

    @Test
    @DisplayName("Config rejects empty sizes and TTLs")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofSeconds(60), true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
        assertTrue(CacheConfig.defaults().enabled());
        assertEquals(Duration.ofDays(7), CacheConfig.defaults().ttl());
    }

    @Test
    @DisplayName("Config properties override the defaults key by key")
    void configFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("curation.cache.ttl-hours", "12");
        properties.setProperty("curation.cache.enabled", "false");

        CacheConfig config = CacheConfig.fromProperties(properties);

        assertEquals(10_000, config.maxResponses());
        assertEquals(Duration.ofHours(12), config.ttl());
        assertInstanceOf(NoOpResponseCache.class, CaffeineResponseCache.create(config));
    }

    @Test
    @DisplayName("Stats since a baseline count only the later lookups")
    void statsSinceBaseline() {
        CacheStats baseline = new CacheStats(10, 5, 1, 12);
        CacheStats now = new CacheStats(13, 6, 1, 14);

        CacheStats run = now.since(baseline);

        assertEquals(new CacheStats(3, 1, 0, 14), run);
        assertEquals(4, run.lookups());
        assertEquals(0.75, run.hitRate());
        assertEquals(0.75, run.toArtifact().get("hit_rate"));
        assertEquals(14L, run.toArtifact().get("cached_responses"));
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("Keys ignore the record id and parameter order")
        void contentAddressed() {
            String a = CacheKeys.keyFor("wikipedia", SourceRequest.of("dam", Map.of("title", "Denver Art Museum", "lang", "en")));
            String b = CacheKeys.keyFor("wikipedia", SourceRequest.of("other", Map.of("lang", "en", "title", "Denver Art Museum")));

            assertEquals(a, b);
            assertEquals(64, a.length());
        }

        @Test
        @DisplayName("Adapter name and parameters change the key")
        void distinct() {
            SourceRequest request = SourceRequest.of("dam", Map.of("title", "Denver Art Museum"));

            assertNotEquals(CacheKeys.keyFor("wikipedia", request), CacheKeys.keyFor("wikidata", request));
            assertNotEquals(CacheKeys.keyFor("wikipedia", request),
                    CacheKeys.keyFor("wikipedia", SourceRequest.of("dam", Map.of("title", "Clyfford Still Museum"))));
        }
    }
}
