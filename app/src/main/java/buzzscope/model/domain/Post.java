package buzzscope.model.domain;

import buzzscope.collector.core.Platform;

import java.time.Instant;
import java.util.Objects;

/**
 * A normalized post. {@code title}, {@code body}, {@code author} and {@code url}
 * are null when the platform did not provide them.
 */
public record Post(
        Platform platform,
        String id,
        String title,
        String body,
        String author,
        Instant timestamp,
        long interactionCount,
        String url
) {
    public Post {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(timestamp, "timestamp");
        if (id == null || id.isBlank()) throw new IllegalArgumentException("post id must not be blank");
        if (interactionCount < 0) throw new IllegalArgumentException("negative interaction count: " + interactionCount);
    }

    /** Title and body joined by a single space, absent parts as empty strings. */
    public String matchText() {
        return (title == null ? "" : title) + " " + (body == null ? "" : body);
    }
}
