package buzzscope.model.domain;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;

import java.util.*;

/** Result of one collect call. Never persisted. */
public record CollectionResult(
        Keyword keyword,
        Mode mode,
        MatchPolicy policy,
        Map<Platform, PlatformResult> platforms,
        List<Post> matched,
        List<String> warnings
) {
    public CollectionResult {
        platforms = Collections.unmodifiableMap(new LinkedHashMap<>(platforms));
        matched = List.copyOf(matched);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public PlatformResult platform(Platform p) { return platforms.get(p); }

    public boolean anyUsable() {
        return platforms.values().stream().anyMatch(PlatformResult::usable);
    }

    public boolean allFromCache() {
        return !platforms.isEmpty() && platforms.values().stream()
                .allMatch(r -> r.status() == PlatformResult.Status.CACHE_HIT);
    }

    /** Call level warnings followed by every platform's warnings. */
    public List<String> allWarnings() {
        List<String> out = new ArrayList<>(warnings);
        platforms.values().forEach(r -> r.warnings().forEach(w -> out.add(r.platform().id() + ": " + w)));
        return out;
    }
}
