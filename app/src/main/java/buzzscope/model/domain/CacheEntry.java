package buzzscope.model.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Posts fetched for one key at one point in time. Replaced whole on refresh. */
public record CacheEntry(
        CacheKey key,
        List<Post> posts,
        Instant collectedAt,
        String sourceLabel,
        int formatVersion
) {
    public static final int FORMAT_VERSION = 1;

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(collectedAt, "collectedAt");
        posts = posts == null ? List.of() : List.copyOf(posts);
    }
}
