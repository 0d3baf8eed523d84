package buzzscope.model.domain;

import java.util.Locale;

/**
 * A user supplied keyword. Two raw strings with the same normalized form
 * share cache entries and notifications.
 */
public record Keyword(String raw, String normalized) {

    public Keyword {
        String expected = normalize(raw);
        if (normalized != null && !normalized.equals(expected)) {
            throw new IllegalArgumentException("'" + normalized + "' is not the normalized form of '" + raw + "'");
        }
        normalized = expected;
    }

    public static Keyword of(String raw) {
        return new Keyword(raw, null);
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("keyword must not be blank");
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    @Override public String toString() { return normalized; }
}
