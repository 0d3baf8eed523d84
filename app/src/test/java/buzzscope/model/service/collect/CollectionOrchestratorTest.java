package buzzscope.model.service.collect;

import buzzscope.collector.core.*;
import buzzscope.model.domain.*;
import buzzscope.model.repository.CacheException;
import buzzscope.model.repository.CacheStore;
import buzzscope.model.repository.FileCacheStore;
import buzzscope.model.service.match.MatchEngine;
import buzzscope.model.service.normalize.RecordNormalizer;
import buzzscope.support.FakeCollector;
import buzzscope.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static buzzscope.collector.core.Platform.*;
import static buzzscope.support.FakeCollector.raw;
import static org.junit.jupiter.api.Assertions.*;

class CollectionOrchestratorTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final CollectSettings FAST = CollectSettings.DEFAULTS.withRetryBackoff(Duration.ZERO);

    @TempDir Path dir;
    final MutableClock clock = new MutableClock(T0);
    final List<CollectionOrchestrator> opened = new ArrayList<>();

    @AfterEach
    void closeAll() { opened.forEach(CollectionOrchestrator::close); }

    CollectionOrchestrator orchestrator(CacheStore cache, CollectSettings settings, PlatformCollector... collectors) {
        Map<Platform, PlatformCollector> m = new EnumMap<>(Platform.class);
        for (PlatformCollector c : collectors) m.put(c.platform(), c);
        CollectionOrchestrator o = new CollectionOrchestrator(m, cache, new RecordNormalizer(), new MatchEngine(), settings, clock);
        opened.add(o);
        return o;
    }

    CollectionOrchestrator orchestrator(PlatformCollector... collectors) {
        return orchestrator(new FileCacheStore(dir, clock), FAST, collectors);
    }

    static RawRecord rec(String id, String title) {
        return raw(id, title, null, "author-" + id, Instant.parse("2024-02-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("cache reuse")
    class CacheReuse {

        @Test
        void secondCallIsAPureCacheHit() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt broker"), rec("2", "zigbee"));
            CollectionOrchestrator o = orchestrator(reddit);

            CollectionResult first = o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            CollectionResult second = o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

            assertEquals(1, reddit.calls());
            assertEquals(PlatformResult.Status.SUCCESS, first.platform(REDDIT).status());
            assertEquals(PlatformResult.Status.CACHE_HIT, second.platform(REDDIT).status());
            assertTrue(second.allFromCache());
            assertEquals(first.matched(), second.matched());
        }

        @Test
        void equivalentKeywordsShareTheEntry() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CollectionOrchestrator o = orchestrator(reddit);

            o.collect("MQTT", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            CollectionResult again = o.collect("  mqtt ", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

            assertEquals(1, reddit.calls());
            assertEquals(List.of("mqtt"), reddit.keywords(), "collectors see the normalized keyword");
            assertEquals(PlatformResult.Status.CACHE_HIT, again.platform(REDDIT).status());
        }

        @Test
        void modesDoNotShareEntries() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CollectionOrchestrator o = orchestrator(reddit);
            o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            o.collect("mqtt", List.of(REDDIT), Mode.HOT, MatchPolicy.EXACT, false);
            assertEquals(2, reddit.calls());
        }

        @Test
        void staleEntryIsRefetched() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CollectionOrchestrator o = orchestrator(reddit);
            o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

            clock.advance(FAST.cacheMaxAge().plusSeconds(1));
            CollectionResult r = o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(2, reddit.calls());
            assertEquals(PlatformResult.Status.SUCCESS, r.platform(REDDIT).status());
        }

        @Test
        void forceRefreshSkipsTheCache() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CollectionOrchestrator o = orchestrator(reddit);
            o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, true);
            assertEquals(2, reddit.calls());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void partialFailureKeepsTheOtherPlatforms() throws Exception {
            FakeCollector hn = FakeCollector.failing(HACKERNEWS, CollectorError.AUTH_INVALID);
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt rocks"));
            CollectionResult r = orchestrator(hn, reddit)
                    .collect("mqtt", List.of(HACKERNEWS, REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);

            PlatformResult failed = r.platform(HACKERNEWS);
            assertEquals(PlatformResult.Status.FAILED, failed.status());
            assertEquals(CollectorError.AUTH_INVALID, failed.error());
            assertEquals(0, failed.postCount());
            assertEquals(1, hn.calls(), "auth errors are not retried");
            assertEquals(List.of("1"), r.matched().stream().map(Post::id).toList());
        }

        @Test
        void allFailedThrowsWithTheFullResult() {
            CollectionOrchestrator o = orchestrator(
                    FakeCollector.failing(HACKERNEWS, CollectorError.RATE_LIMITED),
                    FakeCollector.failing(REDDIT, CollectorError.NETWORK_ERROR));

            NoPlatformAvailableException e = assertThrows(NoPlatformAvailableException.class,
                    () -> o.collect("mqtt", List.of(HACKERNEWS, REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false));
            assertEquals(2, e.result().platforms().size());
            assertFalse(e.result().anyUsable());
        }

        @Test
        void retryableErrorIsRetriedOnce() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt")).thenFail(CollectorError.NETWORK_ERROR);
            CollectionResult r = orchestrator(reddit).collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(2, reddit.calls());
            assertEquals(PlatformResult.Status.SUCCESS, r.platform(REDDIT).status());
        }

        @Test
        void secondFailureIsFinal() throws Exception {
            FakeCollector reddit = FakeCollector.failing(REDDIT, CollectorError.RATE_LIMITED);
            FakeCollector hn = FakeCollector.returning(HACKERNEWS, rec("1", "mqtt"));
            CollectionResult r = orchestrator(reddit, hn)
                    .collect("mqtt", List.of(REDDIT, HACKERNEWS), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(2, reddit.calls());
            assertEquals(CollectorError.RATE_LIMITED, r.platform(REDDIT).error());
        }

        @Test
        void runtimeExceptionCountsAsNetworkError() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT)
                    .then(() -> { throw new IllegalStateException("boom"); })
                    .then(() -> { throw new IllegalStateException("boom again"); });
            FakeCollector hn = FakeCollector.returning(HACKERNEWS, rec("1", "mqtt"));
            CollectionResult r = orchestrator(reddit, hn)
                    .collect("mqtt", List.of(REDDIT, HACKERNEWS), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(CollectorError.NETWORK_ERROR, r.platform(REDDIT).error());
            assertEquals(2, reddit.calls());
        }

        @Test
        void unregisteredPlatformIsNotSupported() throws Exception {
            CollectionResult r = orchestrator(FakeCollector.returning(REDDIT, rec("1", "mqtt")))
                    .collect("mqtt", List.of(REDDIT, YOUTUBE), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(CollectorError.NOT_SUPPORTED, r.platform(YOUTUBE).error());
        }

        @Test
        void corruptEntryIsRefetchedWithAWarning() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CacheStore corrupt = new DelegatingStore(new FileCacheStore(dir, clock)) {
                @Override public buzzscope.model.repository.CacheLookup lookup(CacheKey key) {
                    return buzzscope.model.repository.CacheLookup.corrupt("bad json");
                }
            };
            CollectionResult r = orchestrator(corrupt, FAST, reddit)
                    .collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(PlatformResult.Status.SUCCESS, r.platform(REDDIT).status());
            assertTrue(r.platform(REDDIT).warnings().get(0).contains("bad json"));
        }

        @Test
        void failedCacheWriteDegradesButKeepsPosts() throws Exception {
            FakeCollector reddit = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            CacheStore readOnly = new DelegatingStore(new FileCacheStore(dir, clock)) {
                @Override public CacheEntry put(CacheKey key, List<Post> posts, String label) throws CacheException {
                    throw new CacheException(CacheException.Kind.IO_FAILURE, "disk full");
                }
            };
            CollectionResult r = orchestrator(readOnly, FAST, reddit)
                    .collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            assertEquals(PlatformResult.Status.SUCCESS, r.platform(REDDIT).status());
            assertEquals(1, r.matched().size());
            assertTrue(r.allWarnings().stream().anyMatch(w -> w.contains("disk full")));
        }

        @Test
        void rejectsBadArguments() {
            CollectionOrchestrator o = orchestrator();
            assertThrows(IllegalArgumentException.class,
                    () -> o.collect(" ", List.of(REDDIT), Mode.HOT, MatchPolicy.EXACT, false));
            assertThrows(IllegalArgumentException.class,
                    () -> o.collect("mqtt", List.of(), Mode.HOT, MatchPolicy.EXACT, false));
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        void slowPlatformTimesOutAndNeverWritesTheCache() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            FakeCollector slow = FakeCollector.returning(YOUTUBE).then(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(rec("late", "mqtt"));
            });
            FakeCollector fast = FakeCollector.returning(REDDIT, rec("1", "mqtt"));
            FileCacheStore cache = new FileCacheStore(dir, clock);
            CollectSettings tight = FAST.withTimeouts(Duration.ofMillis(200), Duration.ofSeconds(5));

            CollectionResult r = orchestrator(cache, tight, slow, fast)
                    .collect("mqtt", List.of(YOUTUBE, REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false);
            release.countDown();

            assertEquals(PlatformResult.Status.FAILED, r.platform(YOUTUBE).status());
            assertEquals(CollectorError.NETWORK_ERROR, r.platform(YOUTUBE).error());
            assertEquals(PlatformResult.Status.SUCCESS, r.platform(REDDIT).status());

            Thread.sleep(200);
            assertTrue(cache.get(new CacheKey(YOUTUBE, "mqtt", Mode.HISTORICAL)).isEmpty());
        }
    }

    @Test
    void matchedPostsFollowRequestOrder() throws Exception {
        FakeCollector hn = FakeCollector.returning(HACKERNEWS, rec("h1", "mqtt"), rec("h2", "mqtt too"));
        FakeCollector reddit = FakeCollector.returning(REDDIT, rec("r1", "mqtt"));
        CollectionResult r = orchestrator(hn, reddit)
                .collect("mqtt", List.of(REDDIT, HACKERNEWS), Mode.HISTORICAL, MatchPolicy.EXACT, false);
        assertEquals(List.of("r1", "h1", "h2"), r.matched().stream().map(Post::id).toList());
    }

    @Test
    void interruptedCallerGetsCollectionException() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        FakeCollector blocked = FakeCollector.returning(REDDIT).then(() -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        });
        CollectionOrchestrator o = orchestrator(blocked);

        Thread.currentThread().interrupt();
        try {
            assertThrows(CollectionException.class,
                    () -> o.collect("mqtt", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.EXACT, false));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    /** Forwards everything; tests override the one call they break. */
    static class DelegatingStore implements CacheStore {
        private final CacheStore d;
        DelegatingStore(CacheStore d) { this.d = d; }
        @Override public buzzscope.model.repository.CacheLookup lookup(CacheKey key) { return d.lookup(key); }
        @Override public CacheEntry put(CacheKey key, List<Post> posts, String label) throws CacheException { return d.put(key, posts, label); }
        @Override public boolean isStale(CacheEntry e, Duration maxAge) { return d.isStale(e, maxAge); }
        @Override public buzzscope.model.repository.CacheStats stats() { return d.stats(); }
        @Override public Set<String> cachedKeywords() { return d.cachedKeywords(); }
        @Override public int evict(String keyword) throws CacheException { return d.evict(keyword); }
        @Override public void clear() throws CacheException { d.clear(); }
    }
}
