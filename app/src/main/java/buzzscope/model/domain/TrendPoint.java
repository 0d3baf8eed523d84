package buzzscope.model.domain;

import java.time.LocalDate;

/** Activity in the bucket starting at {@code start} (UTC). Empty buckets are all zeros. */
public record TrendPoint(LocalDate start, long mentions, long uniqueAuthors, long interactions) {}
