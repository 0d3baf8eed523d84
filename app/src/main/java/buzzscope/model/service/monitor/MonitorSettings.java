package buzzscope.model.service.monitor;

import buzzscope.collector.core.Platform;
import buzzscope.model.domain.MatchPolicy;

import java.time.Duration;
import java.util.List;

/**
 * @param keywords  used when the keyword registry has no enabled entry
 * @param retention how long an announced post stays in the notified set
 */
public record MonitorSettings(
        List<String> keywords,
        List<Platform> platforms,
        MatchPolicy policy,
        Duration interval,
        Duration retention,
        boolean forceRefresh
) {
    public MonitorSettings {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        if (platforms.isEmpty()) throw new IllegalArgumentException("monitor needs at least one platform");
        if (interval.isNegative() || interval.isZero()) throw new IllegalArgumentException("interval must be positive");
        if (retention.isNegative()) throw new IllegalArgumentException("retention must not be negative");
    }
}
