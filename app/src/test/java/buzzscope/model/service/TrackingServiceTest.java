package buzzscope.model.service;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.collector.core.PlatformCollector;
import buzzscope.collector.core.RawRecord;
import buzzscope.model.domain.*;
import buzzscope.model.repository.CacheStats;
import buzzscope.model.service.config.AppConfig;
import buzzscope.support.FakeCollector;
import buzzscope.support.MutableClock;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static buzzscope.support.FakeCollector.raw;
import static org.junit.jupiter.api.Assertions.*;

class TrackingServiceTest {
    @TempDir Path dir;
    final MutableClock clock = MutableClock.at("2024-03-01T00:00:00Z");
    FakeCollector reddit;
    TrackingService svc;

    static AppConfig config(Path dataDir) {
        return AppConfig.from(ConfigFactory.parseResources("test-buzzscope.conf")
                .withValue("buzzscope.data-dir", ConfigValueFactory.fromAnyRef(dataDir.toString()))
                .resolve());
    }

    static RawRecord rec(String id, String title, String body, String day) {
        return raw(id, title, body, "user" + id, Instant.parse(day + "T09:00:00Z"));
    }

    @BeforeEach
    void setUp() throws Exception {
        reddit = FakeCollector.returning(Platform.REDDIT,
                rec("1", "MQTT broker setup", null, "2024-02-01"),
                rec("2", "Switching protocols", "I moved everything to mqtt.", "2024-02-01"),
                rec("3", "Why (mqtt) beats polling", null, "2024-02-03"),
                rec("4", "mosquitto-mqttx client released", null, "2024-02-04"),
                rec("5", "Zigbee vs Thread", null, "2024-02-04"));
        Map<Platform, PlatformCollector> collectors = Map.of(Platform.REDDIT, reddit);
        svc = TrackingService.create(config(dir), collectors, clock);
    }

    @AfterEach
    void tearDown() { svc.close(); }

    @Test
    void mqttEndToEnd() throws Exception {
        CollectionResult exact = svc.collect("mqtt", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

        assertEquals(3, exact.matched().size());
        assertEquals(1, reddit.calls());
        PlatformResult pr = exact.platform(Platform.REDDIT);
        assertEquals(PlatformResult.Status.SUCCESS, pr.status());
        assertEquals(5, pr.postCount(), "the cache keeps every fetched post, not only matches");

        CacheStats stats = svc.cacheStats();
        assertEquals(1, stats.totalEntries());
        assertEquals(5, stats.totalPosts());

        CollectionResult fuzzy = svc.collect("mqtt", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.FUZZY, false);
        assertEquals(1, reddit.calls(), "fuzzy rerun is served from the cache");
        assertEquals(PlatformResult.Status.CACHE_HIT, fuzzy.platform(Platform.REDDIT).status());
        assertEquals(4, fuzzy.matched().size());

        Metrics m = svc.analyze(exact);
        assertEquals(3, m.totalMentions());
        assertEquals(3, m.uniqueAuthors());
        assertEquals(Bucket.MONTH, m.bucket());
        assertEquals(1, m.trend().size());
        assertEquals(3, m.topContributors().size());
    }

    @Test
    void analyzeCachedAndEvict() throws Exception {
        svc.collect("mqtt", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

        assertEquals(4, svc.analyzeCached("MQTT", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.FUZZY).totalMentions());
        assertEquals(1, svc.evict("mqtt"));
        assertEquals(0, svc.analyzeCached("mqtt", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.FUZZY).totalMentions());
    }

    @Test
    void collectMarksTrackedKeywordsAnalyzed() throws Exception {
        svc.keywords().add("MQTT", List.of(Platform.REDDIT));
        svc.collect("mqtt", List.of(Platform.REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
        assertEquals(clock.instant(), svc.keywords().find("mqtt").orElseThrow().lastAnalyzed());
    }
}
