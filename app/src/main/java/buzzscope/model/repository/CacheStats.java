package buzzscope.model.repository;

import buzzscope.collector.core.Platform;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record CacheStats(Map<Platform, PlatformStats> platforms, Instant lastCollectedAt, int corruptEntries) {

    /**
     * @param keywords    per normalized keyword, sorted
     * @param oldestPost  earliest post timestamp on the platform, null when no post is cached
     * @param newestPost  latest post timestamp on the platform, null when no post is cached
     */
    public record PlatformStats(int entries,
                                Map<String, KeywordStats> keywords,
                                long posts,
                                Instant lastCollectedAt,
                                Instant oldestPost,
                                Instant newestPost) {
        public PlatformStats {
            keywords = Collections.unmodifiableMap(new TreeMap<>(keywords));
        }

        public int keywordCount() { return keywords.size(); }
    }

    /** Entries (one per mode) and cached posts of one keyword on one platform. */
    public record KeywordStats(int entries, long posts, Instant lastCollectedAt) {}

    public CacheStats {
        platforms = Map.copyOf(platforms);
    }

    public int totalEntries() {
        return platforms.values().stream().mapToInt(PlatformStats::entries).sum();
    }

    public long totalPosts() {
        return platforms.values().stream().mapToLong(PlatformStats::posts).sum();
    }
}
