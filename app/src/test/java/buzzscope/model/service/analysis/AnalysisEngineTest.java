package buzzscope.model.service.analysis;

import buzzscope.collector.core.Mode;
import buzzscope.model.domain.*;
import buzzscope.model.repository.FileCacheStore;
import buzzscope.model.service.match.MatchEngine;
import buzzscope.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static buzzscope.collector.core.Platform.*;
import static buzzscope.support.Posts.post;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisEngineTest {
    private final AnalysisEngine engine = new AnalysisEngine();

    @Test
    void emptyInput() {
        Metrics m = engine.analyze(List.of());
        assertEquals(0, m.totalMentions());
        assertTrue(m.trend().isEmpty());
        assertNull(m.firstMention());
        assertEquals(TrendSummary.EMPTY, m.summary());
    }

    @Test
    void volumeAuthorsAndInteractions() {
        Metrics m = engine.analyze(List.of(
                post(REDDIT, "1", "t", null, "alice", "2024-01-01T10:00:00Z", 10),
                post(REDDIT, "2", "t", null, "alice", "2024-01-01T11:00:00Z", 5),
                post(HACKERNEWS, "3", "t", null, null, "2024-01-02T09:00:00Z", 7),
                post(HACKERNEWS, "4", "t", null, " ", "2024-01-02T09:30:00Z", 0)));

        assertEquals(4, m.totalMentions());
        assertEquals(1, m.uniqueAuthors());
        assertEquals(22, m.totalInteractions());
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), m.firstMention());
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), m.lastMention());
    }

    @Test
    void trendGapsAreZeroFilled() {
        Metrics m = engine.analyze(List.of(
                post(REDDIT, "1", "a", "2024-01-01T23:59:59Z"),
                post(REDDIT, "2", "b", "2024-01-03T00:00:00Z"),
                post(REDDIT, "3", "c", "2024-01-03T12:00:00Z")));

        assertEquals(List.of(
                new TrendPoint(LocalDate.parse("2024-01-01"), 1, 1, 1),
                new TrendPoint(LocalDate.parse("2024-01-02"), 0, 0, 0),
                new TrendPoint(LocalDate.parse("2024-01-03"), 2, 2, 2)), m.trend());
    }

    @Test
    void monthBuckets() {
        AnalysisEngine monthly = new AnalysisEngine(Bucket.MONTH, 10, new MatchEngine());
        Metrics m = monthly.analyze(List.of(
                post(REDDIT, "1", "a", "2023-11-30T10:00:00Z"),
                post(REDDIT, "2", "b", "2024-01-15T00:00:00Z")));
        assertEquals(List.of(
                new TrendPoint(LocalDate.parse("2023-11-01"), 1, 1, 1),
                new TrendPoint(LocalDate.parse("2023-12-01"), 0, 0, 0),
                new TrendPoint(LocalDate.parse("2024-01-01"), 1, 1, 1)), m.trend());
        assertEquals(Bucket.MONTH, m.bucket());
    }

    @Test
    void contributorTieBreaksOnFirstMention() {
        List<Post> posts = new ArrayList<>();
        posts.add(post(REDDIT, "b1", "bob", "2024-01-02T00:00:00Z"));
        posts.add(post(REDDIT, "b2", "bob", "2024-01-05T00:00:00Z"));
        posts.add(post(REDDIT, "b3", "bob", "2024-01-06T00:00:00Z"));
        posts.add(post(REDDIT, "a1", "alice", "2024-01-03T00:00:00Z"));
        posts.add(post(REDDIT, "a2", "alice", "2024-01-01T00:00:00Z"));
        posts.add(post(REDDIT, "a3", "alice", "2024-01-04T00:00:00Z"));
        posts.add(post(REDDIT, "c1", "carol", "2023-12-01T00:00:00Z"));

        List<Contributor> top = engine.analyze(posts).topContributors();
        assertEquals(List.of("alice", "bob", "carol"), top.stream().map(Contributor::author).toList());
        assertEquals(3, top.get(0).mentions());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), top.get(0).firstMention());
    }

    @Test
    void contributorLimitApplies() {
        AnalysisEngine two = new AnalysisEngine(Bucket.DAY, 2, new MatchEngine());
        List<Post> posts = List.of(
                post(REDDIT, "1", "a", "2024-01-01T00:00:00Z"),
                post(REDDIT, "2", "b", "2024-01-01T00:00:00Z"),
                post(REDDIT, "3", "c", "2024-01-01T00:00:00Z"));
        assertEquals(List.of("a", "b"), two.analyze(posts).topContributors().stream().map(Contributor::author).toList());
    }

    @Test
    void perPlatformSubtotalsPartitionTheSet() {
        Metrics m = engine.analyze(List.of(
                post(REDDIT, "1", "t", null, "alice", "2024-01-01T00:00:00Z", 3),
                post(YOUTUBE, "2", "t", null, "alice", "2024-01-01T00:00:00Z", 100),
                post(YOUTUBE, "3", "t", null, "bob", "2024-01-01T00:00:00Z", 50)));
        assertEquals(List.of(
                new PlatformSubtotal(REDDIT, 1, 1, 3),
                new PlatformSubtotal(YOUTUBE, 2, 2, 150)), m.perPlatform());
        assertEquals(m.totalMentions(), m.perPlatform().stream().mapToLong(PlatformSubtotal::mentions).sum());
    }

    @Test
    void bucketsCarryAuthorsAndInteractions() {
        Metrics m = engine.analyze(List.of(
                post(REDDIT, "1", "t", null, "alice", "2024-01-01T08:00:00Z", 3),
                post(REDDIT, "2", "t", null, "alice", "2024-01-01T09:00:00Z", 4),
                post(YOUTUBE, "3", "t", null, "bob", "2024-01-01T10:00:00Z", 10),
                post(YOUTUBE, "4", "t", null, " ", "2024-01-03T10:00:00Z", 2)));
        assertEquals(List.of(
                new TrendPoint(LocalDate.parse("2024-01-01"), 3, 2, 17),
                new TrendPoint(LocalDate.parse("2024-01-02"), 0, 0, 0),
                new TrendPoint(LocalDate.parse("2024-01-03"), 1, 0, 2)), m.trend());
    }

    @Test
    void samplePostsAreTheMostEngaging() {
        List<Post> posts = List.of(
                post(REDDIT, "low", "t", null, "a", "2024-01-01T00:00:00Z", 1),
                post(REDDIT, "old", "t", null, "a", "2024-01-01T00:00:00Z", 50),
                post(REDDIT, "new", "t", null, "b", "2024-01-02T00:00:00Z", 50),
                post(YOUTUBE, "top", "t", null, "c", "2024-01-01T00:00:00Z", 900));

        assertEquals(List.of("top", "new", "old", "low"),
                engine.analyze(posts).samplePosts().stream().map(Post::id).toList());
        AnalysisEngine two = new AnalysisEngine(Bucket.DAY, 10, 2, new MatchEngine());
        assertEquals(List.of("top", "new"), two.analyze(posts).samplePosts().stream().map(Post::id).toList());
        assertTrue(engine.analyze(List.of()).samplePosts().isEmpty());
    }

    static TrendPoint point(LocalDate start, long mentions) {
        return new TrendPoint(start, mentions, 0, 0);
    }

    @Test
    void summaryDirectionAndPeak() {
        List<TrendPoint> rising = new ArrayList<>();
        for (int i = 0; i < 14; i++) rising.add(point(LocalDate.parse("2024-01-01").plusDays(i), i < 7 ? 1 : 3));
        TrendSummary up = AnalysisEngine.summarize(rising);
        assertEquals(TrendSummary.Direction.UP, up.direction());
        assertEquals(2.0, up.changeRatio(), 1e-9);
        assertEquals(LocalDate.parse("2024-01-08"), up.peakStart());
        assertEquals(3, up.peakMentions());

        TrendSummary shortSeries = AnalysisEngine.summarize(List.of(
                point(LocalDate.parse("2024-01-01"), 10),
                point(LocalDate.parse("2024-01-02"), 0),
                point(LocalDate.parse("2024-01-03"), 0)));
        // both windows cover the whole short series
        assertEquals(TrendSummary.Direction.STABLE, shortSeries.direction());

        TrendSummary single = AnalysisEngine.summarize(List.of(point(LocalDate.parse("2024-01-01"), 4)));
        assertNull(single.changeRatio());
        assertEquals(4, single.peakMentions());
    }

    @Test
    void analyzeCachedReadsWithoutFetching(@TempDir Path dir) throws Exception {
        FileCacheStore cache = new FileCacheStore(dir, MutableClock.at("2024-01-10T00:00:00Z"));
        cache.put(new CacheKey(REDDIT, "ai", Mode.HISTORICAL), List.of(
                post(REDDIT, "1", "the AI model", null, "a", "2024-01-01T00:00:00Z", 1),
                post(REDDIT, "2", "airplane", null, "b", "2024-01-01T00:00:00Z", 1)), "l");

        assertEquals(1, engine.analyzeCached(cache, "AI", List.of(REDDIT, YOUTUBE), Mode.HISTORICAL, MatchPolicy.EXACT).totalMentions());
        assertEquals(2, engine.analyzeCached(cache, "AI", List.of(REDDIT), Mode.HISTORICAL, MatchPolicy.FUZZY).totalMentions());
    }
}
