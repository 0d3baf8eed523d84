package buzzscope.collector.core;

import java.util.Map;

/**
 * One record as a platform returned it, before normalization.
 *
 * @param createdAt raw timestamp text: epoch seconds, epoch millis or ISO-8601
 * @param counters  platform specific integer fields (score, num_comments, view_count ...)
 */
public record RawRecord(
        String id,
        String title,
        String body,
        String author,
        String createdAt,
        String url,
        Map<String, Long> counters
) {
    public RawRecord {
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    public long counter(String name) {
        Long v = counters.get(name);
        return v == null ? 0L : v;
    }
}
