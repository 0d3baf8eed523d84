package buzzscope.model.domain;

import buzzscope.collector.core.Platform;

import java.time.Instant;
import java.util.List;

/** An entry of the keyword registry. */
public record TrackedKeyword(
        String keyword,
        List<Platform> platforms,
        boolean enabled,
        Instant createdAt,
        Instant lastAnalyzed
) {
    public TrackedKeyword {
        keyword = Keyword.normalize(keyword);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public TrackedKeyword withEnabled(boolean on) {
        return new TrackedKeyword(keyword, platforms, on, createdAt, lastAnalyzed);
    }

    public TrackedKeyword withLastAnalyzed(Instant at) {
        return new TrackedKeyword(keyword, platforms, enabled, createdAt, at);
    }
}
