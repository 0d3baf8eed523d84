package buzzscope.model.domain;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordTest {

    @Test
    void normalizesCaseAndWhitespace() {
        assertEquals("home assistant", Keyword.of("  Home Assistant ").normalized());
        assertEquals(Keyword.of("MQTT").normalized(), Keyword.of("mqtt ").normalized());
    }

    @Test
    void rejectsBlank() {
        assertThrows(IllegalArgumentException.class, () -> Keyword.of("   "));
        assertThrows(IllegalArgumentException.class, () -> Keyword.of(null));
    }

    @Test
    void rejectsInconsistentNormalizedForm() {
        assertThrows(IllegalArgumentException.class, () -> new Keyword("MQTT", "zigbee"));
    }

    @Test
    void equivalentKeywordsShareCacheKeys() {
        CacheKey a = CacheKey.of(Platform.REDDIT, Keyword.of("MQTT"), Mode.HISTORICAL);
        CacheKey b = CacheKey.of(Platform.REDDIT, Keyword.of(" mqtt"), Mode.HISTORICAL);
        assertEquals(a, b);
        assertEquals(a.relativePath(), b.relativePath());
    }

    @Test
    void cachePathsSeparateModesAndPlatforms() {
        CacheKey hist = new CacheKey(Platform.REDDIT, "mqtt", Mode.HISTORICAL);
        CacheKey hot = new CacheKey(Platform.REDDIT, "mqtt", Mode.HOT);
        CacheKey hn = new CacheKey(Platform.HACKERNEWS, "mqtt", Mode.HISTORICAL);
        assertTrue(hist.relativePath().startsWith("reddit/historical/mqtt-"), hist.relativePath());
        assertTrue(hot.relativePath().startsWith("reddit/hot/"), hot.relativePath());
        assertTrue(hn.relativePath().startsWith("hackernews/historical/"), hn.relativePath());
        assertTrue(hist.relativePath().endsWith(".json"));
    }

    @Test
    void slugCollisionsStillGetDistinctPaths() {
        CacheKey cpp = new CacheKey(Platform.HACKERNEWS, "c++", Mode.HISTORICAL);
        CacheKey csharp = new CacheKey(Platform.HACKERNEWS, "c#", Mode.HISTORICAL);
        assertEquals("c", CacheKey.slug("c++"));
        assertNotEquals(cpp.relativePath(), csharp.relativePath());
        assertEquals("kw", CacheKey.slug("日本"));
    }
}
