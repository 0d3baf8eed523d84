package buzzscope.model.domain;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.Instant;
import java.util.Locale;

/** Trend bucket granularity, always in UTC. */
public enum Bucket {
    DAY, MONTH;

    public LocalDate floor(Instant t) {
        LocalDate d = t.atZone(ZoneOffset.UTC).toLocalDate();
        return this == DAY ? d : d.withDayOfMonth(1);
    }

    public LocalDate next(LocalDate start) {
        return this == DAY ? start.plusDays(1) : start.plusMonths(1);
    }

    public static Bucket fromId(String s) {
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("unknown bucket: " + s, e);
        }
    }
}
