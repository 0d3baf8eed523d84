package buzzscope.collector.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Platform {
    HACKERNEWS("hackernews", "Hacker News"),
    REDDIT("reddit", "Reddit"),
    YOUTUBE("youtube", "YouTube"),
    DISCORD("discord", "Discord");

    private final String id;
    private final String displayName;

    Platform(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String id() { return id; }

    public String displayName() { return displayName; }

    /** Accepts the lower-case id ("reddit") or the enum name ("REDDIT"). */
    @JsonCreator
    public static Platform fromId(String s) {
        if (s == null) throw new IllegalArgumentException("platform is null");
        String n = s.trim().toLowerCase(Locale.ROOT);
        for (Platform p : values()) {
            if (p.id.equals(n)) return p;
        }
        throw new IllegalArgumentException("Unknown platform: " + s);
    }
}
