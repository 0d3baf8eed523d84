package buzzscope.model.domain;

import java.util.Locale;

public enum MatchPolicy {
    /** Whole phrase, bounded by non-alphanumeric characters or the text edges. */
    EXACT,
    /** Plain substring. */
    FUZZY;

    public static MatchPolicy fromId(String s) {
        if (s == null) throw new IllegalArgumentException("match policy is null");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown match policy: " + s, e);
        }
    }
}
