package buzzscope.model.service.normalize;

import buzzscope.collector.core.Platform;
import buzzscope.collector.core.RawRecord;

import java.util.Map;

/**
 * How each platform's counters add up to one interaction count. Every weight is 1
 * and counts are not rescaled across platforms, so a YouTube view and a Reddit
 * upvote weigh the same. Changing the table means bumping {@link #VERSION}.
 */
public final class InteractionWeights {
    public static final String VERSION = "v1";

    private static final Map<Platform, Map<String, Long>> TABLE = Map.of(
            Platform.HACKERNEWS, Map.of("score", 1L, "descendants", 1L),
            Platform.REDDIT, Map.of("score", 1L, "num_comments", 1L),
            Platform.YOUTUBE, Map.of("view_count", 1L, "like_count", 1L, "comment_count", 1L),
            Platform.DISCORD, Map.of("reactions", 1L)
    );

    private InteractionWeights() {}

    public static Map<String, Long> weightsFor(Platform p) {
        return TABLE.get(p);
    }

    /** Weighted sum of the platform's counters; negative counters count as 0. */
    public static long interactionCount(Platform p, RawRecord r) {
        long total = 0;
        for (Map.Entry<String, Long> w : TABLE.get(p).entrySet()) {
            long v = Math.max(0L, r.counter(w.getKey()));
            total = Math.addExact(total, Math.multiplyExact(v, w.getValue()));
        }
        return total;
    }
}
