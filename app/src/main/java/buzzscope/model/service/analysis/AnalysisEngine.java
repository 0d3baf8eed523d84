package buzzscope.model.service.analysis;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.model.domain.*;
import buzzscope.model.repository.CacheStore;
import buzzscope.model.service.match.MatchEngine;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Volume, trend and contributor metrics over a set of matched posts.
 * Stateless; every figure is derived from the posts passed in.
 */
public class AnalysisEngine {
    private static final int SUMMARY_WINDOW = 7;
    private static final double UP_RATIO = 1.2;
    private static final double DOWN_RATIO = 0.8;
    public static final int DEFAULT_SAMPLE_LIMIT = 5;

    private final Bucket bucket;
    private final int contributorLimit;
    private final int sampleLimit;
    private final MatchEngine matcher;

    public AnalysisEngine(Bucket bucket, int contributorLimit, int sampleLimit, MatchEngine matcher) {
        if (contributorLimit < 0) throw new IllegalArgumentException("contributorLimit < 0");
        if (sampleLimit < 0) throw new IllegalArgumentException("sampleLimit < 0");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.contributorLimit = contributorLimit;
        this.sampleLimit = sampleLimit;
        this.matcher = matcher;
    }

    public AnalysisEngine(Bucket bucket, int contributorLimit, MatchEngine matcher) {
        this(bucket, contributorLimit, DEFAULT_SAMPLE_LIMIT, matcher);
    }

    public AnalysisEngine() { this(Bucket.DAY, 10, new MatchEngine()); }

    /* ---------- Public API ---------- */

    public Metrics analyze(CollectionResult result) {
        return analyze(result.matched());
    }

    /**
     * Metrics over whatever the cache holds for the keyword, stale or not.
     * Nothing is fetched.
     */
    public Metrics analyzeCached(CacheStore cache, String keyword, Collection<Platform> platforms,
                                 Mode mode, MatchPolicy policy) {
        Keyword k = Keyword.of(keyword);
        List<Post> matched = new ArrayList<>();
        for (Platform p : new LinkedHashSet<>(platforms)) {
            cache.get(CacheKey.of(p, k, mode))
                    .ifPresent(e -> matched.addAll(matcher.filter(e.posts(), k.normalized(), policy)));
        }
        return analyze(matched);
    }

    public Metrics analyze(List<Post> posts) {
        long interactions = 0;
        Instant first = null, last = null;
        for (Post p : posts) {
            interactions += p.interactionCount();
            if (first == null || p.timestamp().isBefore(first)) first = p.timestamp();
            if (last == null || p.timestamp().isAfter(last)) last = p.timestamp();
        }
        List<TrendPoint> trend = trend(posts);
        return new Metrics(
                posts.size(),
                uniqueAuthors(posts),
                interactions,
                bucket,
                trend,
                topContributors(posts),
                samplePosts(posts),
                perPlatform(posts),
                first, last,
                summarize(trend));
    }

    /* ---------- Pieces ---------- */

    List<TrendPoint> trend(List<Post> posts) {
        if (posts.isEmpty()) return List.of();
        TreeMap<LocalDate, List<Post>> buckets = new TreeMap<>();
        for (Post p : posts) buckets.computeIfAbsent(bucket.floor(p.timestamp()), k -> new ArrayList<>()).add(p);

        List<TrendPoint> out = new ArrayList<>();
        LocalDate end = buckets.lastKey();
        for (LocalDate d = buckets.firstKey(); !d.isAfter(end); d = bucket.next(d)) {
            List<Post> in = buckets.getOrDefault(d, List.of());
            out.add(new TrendPoint(d, in.size(), uniqueAuthors(in), in.stream().mapToLong(Post::interactionCount).sum()));
        }
        return out;
    }

    /** Most engaging posts: interactions desc, then newest first, then id. */
    List<Post> samplePosts(List<Post> posts) {
        return posts.stream()
                .sorted(Comparator.comparingLong(Post::interactionCount).reversed()
                        .thenComparing(Post::timestamp, Comparator.reverseOrder())
                        .thenComparing(Post::id))
                .limit(sampleLimit)
                .toList();
    }

    List<Contributor> topContributors(List<Post> posts) {
        Map<String, long[]> acc = new HashMap<>();        // mentions, interactions
        Map<String, Instant> firstSeen = new HashMap<>();
        for (Post p : posts) {
            String a = author(p);
            if (a == null) continue;
            long[] v = acc.computeIfAbsent(a, k -> new long[2]);
            v[0]++;
            v[1] += p.interactionCount();
            firstSeen.merge(a, p.timestamp(), (x, y) -> x.isBefore(y) ? x : y);
        }
        return acc.entrySet().stream()
                .map(e -> new Contributor(e.getKey(), e.getValue()[0], firstSeen.get(e.getKey()), e.getValue()[1]))
                .sorted(Comparator.comparingLong(Contributor::mentions).reversed()
                        .thenComparing(Contributor::firstMention)
                        .thenComparing(Contributor::author))
                .limit(contributorLimit)
                .toList();
    }

    List<PlatformSubtotal> perPlatform(List<Post> posts) {
        Map<Platform, List<Post>> byPlatform = new EnumMap<>(Platform.class);
        for (Post p : posts) byPlatform.computeIfAbsent(p.platform(), k -> new ArrayList<>()).add(p);

        List<PlatformSubtotal> out = new ArrayList<>();
        byPlatform.forEach((platform, list) -> out.add(new PlatformSubtotal(platform, list.size(),
                uniqueAuthors(list), list.stream().mapToLong(Post::interactionCount).sum())));
        return out;
    }

    /** Mean of the last 7 buckets against the first 7; the windows overlap on short series. */
    static TrendSummary summarize(List<TrendPoint> trend) {
        if (trend.isEmpty()) return TrendSummary.EMPTY;

        TrendPoint peak = trend.get(0);
        for (TrendPoint t : trend) if (t.mentions() > peak.mentions()) peak = t;

        if (trend.size() < 2) {
            return new TrendSummary(TrendSummary.Direction.STABLE, null, peak.start(), peak.mentions());
        }
        int w = Math.min(SUMMARY_WINDOW, trend.size());
        double early = mean(trend.subList(0, w));
        double recent = mean(trend.subList(trend.size() - w, trend.size()));

        TrendSummary.Direction dir;
        if (recent > early * UP_RATIO) dir = TrendSummary.Direction.UP;
        else if (recent < early * DOWN_RATIO) dir = TrendSummary.Direction.DOWN;
        else dir = TrendSummary.Direction.STABLE;

        Double change = early == 0 ? null : recent / early - 1.0;
        return new TrendSummary(dir, change, peak.start(), peak.mentions());
    }

    private static double mean(List<TrendPoint> points) {
        return points.stream().mapToLong(TrendPoint::mentions).average().orElse(0);
    }

    private static long uniqueAuthors(List<Post> posts) {
        return posts.stream().map(AnalysisEngine::author).filter(Objects::nonNull).distinct().count();
    }

    private static String author(Post p) {
        String a = p.author();
        return a == null || a.isBlank() ? null : a;
    }
}
