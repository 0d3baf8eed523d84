package buzzscope.model.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable set of announced posts with the time each was announced.
 * Monitor cycles take one and return the next.
 */
public final class NotifiedSet {
    public static final NotifiedSet EMPTY = new NotifiedSet(Map.of());

    private final Map<NotifiedKey, Instant> entries;

    public NotifiedSet(Map<NotifiedKey, Instant> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public boolean contains(NotifiedKey key) { return entries.containsKey(key); }

    public int size() { return entries.size(); }

    public Map<NotifiedKey, Instant> entries() { return entries; }

    public NotifiedSet plus(Map<NotifiedKey, Instant> added) {
        if (added.isEmpty()) return this;
        Map<NotifiedKey, Instant> m = new LinkedHashMap<>(entries);
        added.forEach(m::putIfAbsent);
        return new NotifiedSet(m);
    }

    /** Drops entries announced before {@code cutoff}. */
    public NotifiedSet prunedBefore(Instant cutoff) {
        Map<NotifiedKey, Instant> m = new LinkedHashMap<>();
        entries.forEach((k, at) -> { if (!at.isBefore(cutoff)) m.put(k, at); });
        return m.size() == entries.size() ? this : new NotifiedSet(m);
    }

    @Override public boolean equals(Object o) {
        return o instanceof NotifiedSet other && entries.equals(other.entries);
    }

    @Override public int hashCode() { return entries.hashCode(); }

    @Override public String toString() { return "NotifiedSet" + entries.keySet(); }
}
