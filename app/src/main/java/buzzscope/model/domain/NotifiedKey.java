package buzzscope.model.domain;

import buzzscope.collector.core.Platform;

import java.util.Objects;

/** A post already announced by the monitor. */
public record NotifiedKey(Platform platform, String id) {
    public NotifiedKey {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(id, "id");
    }

    public static NotifiedKey of(Post p) { return new NotifiedKey(p.platform(), p.id()); }
}
