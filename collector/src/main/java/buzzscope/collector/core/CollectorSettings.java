package buzzscope.collector.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

/**
 * Everything the platform collectors need from configuration.
 *
 * @param youtubeApiKey may be null; the YouTube collector then fails with AUTH_INVALID
 */
public record CollectorSettings(
        Set<Platform> enabled,
        String userAgent,
        Duration httpTimeout,
        String youtubeApiKey,
        Path discordArchiveDir
) {
    public CollectorSettings {
        enabled = enabled == null ? Set.of() : Set.copyOf(enabled);
        if (userAgent == null || userAgent.isBlank()) userAgent = "BuzzScope/1.0";
        if (httpTimeout == null) httpTimeout = Duration.ofSeconds(20);
    }
}
