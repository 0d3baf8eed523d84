package buzzscope.model.domain;

import java.time.LocalDate;

/**
 * @param changeRatio (recent mean - early mean) / early mean; null when the series
 *                    has fewer than two buckets or the early mean is zero
 */
public record TrendSummary(Direction direction, Double changeRatio, LocalDate peakStart, long peakMentions) {
    public enum Direction { UP, DOWN, STABLE }

    public static final TrendSummary EMPTY = new TrendSummary(Direction.STABLE, null, null, 0);
}
