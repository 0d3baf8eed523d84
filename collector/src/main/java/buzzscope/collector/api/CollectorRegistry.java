package buzzscope.collector.api;

import buzzscope.collector.core.CollectorSettings;
import buzzscope.collector.core.Platform;
import buzzscope.collector.core.PlatformCollector;
import buzzscope.collector.sources.discord.DiscordArchiveCollector;
import buzzscope.collector.sources.hackernews.HackerNewsCollector;
import buzzscope.collector.sources.reddit.RedditCollector;
import buzzscope.collector.sources.youtube.YouTubeCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Builds one collector per enabled platform. */
public final class CollectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(CollectorRegistry.class);

    private CollectorRegistry() {}

    public static Map<Platform, PlatformCollector> build(CollectorSettings settings) {
        Map<Platform, PlatformCollector> out = new EnumMap<>(Platform.class);
        for (Platform p : settings.enabled()) {
            out.put(p, create(p, settings));
        }
        log.info("[Collector] enabled: {}", out.keySet());
        return Collections.unmodifiableMap(out);
    }

    public static PlatformCollector create(Platform platform, CollectorSettings settings) {
        return switch (platform) {
            case HACKERNEWS -> new HackerNewsCollector(settings);
            case REDDIT -> new RedditCollector(settings);
            case YOUTUBE -> new YouTubeCollector(settings);
            case DISCORD -> new DiscordArchiveCollector(settings);
        };
    }
}
