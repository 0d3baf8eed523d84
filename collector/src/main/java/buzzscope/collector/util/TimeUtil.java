package buzzscope.collector.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

public final class TimeUtil {
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{1,11}$");
    private static final Pattern EPOCH_MILLIS  = Pattern.compile("^\\d{12,13}$");
    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeUtil() {}

    public static String toIsoInstant(Instant t) { return DateTimeFormatter.ISO_INSTANT.format(t); }

    public static String isoDate(Instant t) {
        return DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC).format(t);
    }

    /**
     * Parses the timestamp shapes the collectors emit. Local date-times without
     * an offset are read as UTC. Empty when nothing fits.
     */
    public static Optional<Instant> parseInstant(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String x = s.trim();

        if (EPOCH_MILLIS.matcher(x).matches()) return Optional.of(Instant.ofEpochMilli(Long.parseLong(x)));
        if (EPOCH_SECONDS.matcher(x).matches()) return Optional.of(Instant.ofEpochSecond(Long.parseLong(x)));

        try { return Optional.of(Instant.parse(x)); }
        catch (DateTimeParseException ignore) { /* try the next shape */ }

        try { return Optional.of(OffsetDateTime.parse(x).toInstant()); }
        catch (DateTimeParseException ignore) { /* try the next shape */ }

        try { return Optional.of(LocalDateTime.parse(x).toInstant(ZoneOffset.UTC)); }
        catch (DateTimeParseException ignore) { /* try the next shape */ }

        try { return Optional.of(LocalDateTime.parse(x, SPACED).toInstant(ZoneOffset.UTC)); }
        catch (DateTimeParseException ignore) { /* fall through */ }

        return Optional.empty();
    }
}
