package buzzscope.model.domain;

import buzzscope.collector.core.CollectorError;
import buzzscope.collector.core.Platform;

import java.time.Instant;
import java.util.List;

/**
 * Outcome for one platform within one collect call.
 *
 * @param posts every post the platform produced, before keyword matching
 * @param error set only when {@code status} is FAILED
 */
public record PlatformResult(
        Platform platform,
        Status status,
        CollectorError error,
        String reason,
        List<Post> posts,
        String sourceLabel,
        Instant collectedAt,
        List<String> warnings
) {
    public enum Status { SUCCESS, FAILED, CACHE_HIT }

    public PlatformResult {
        posts = posts == null ? List.of() : List.copyOf(posts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static PlatformResult success(Platform p, List<Post> posts, String label, Instant at, List<String> warnings) {
        return new PlatformResult(p, Status.SUCCESS, null, null, posts, label, at, warnings);
    }

    public static PlatformResult cacheHit(Platform p, CacheEntry entry, List<String> warnings) {
        return new PlatformResult(p, Status.CACHE_HIT, null, null, entry.posts(), entry.sourceLabel(),
                entry.collectedAt(), warnings);
    }

    public static PlatformResult failed(Platform p, CollectorError error, String reason, List<String> warnings) {
        return new PlatformResult(p, Status.FAILED, error, reason, List.of(), null, null, warnings);
    }

    public boolean usable() { return status != Status.FAILED; }

    public int postCount() { return posts.size(); }
}
