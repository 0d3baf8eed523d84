package buzzscope.collector.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Collection strategy: broad all-time search, or today's trending listing. */
public enum Mode {
    HISTORICAL("historical"),
    HOT("hot");

    private final String id;

    Mode(String id) { this.id = id; }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static Mode fromId(String s) {
        if (s == null) throw new IllegalArgumentException("mode is null");
        String n = s.trim().toLowerCase(Locale.ROOT);
        for (Mode m : values()) {
            if (m.id.equals(n)) return m;
        }
        throw new IllegalArgumentException("Unknown mode: " + s);
    }
}
