package buzzscope.model.service.config;

import buzzscope.collector.core.CollectorSettings;
import buzzscope.collector.core.Platform;
import buzzscope.model.domain.Bucket;
import buzzscope.model.domain.MatchPolicy;
import buzzscope.model.service.collect.CollectSettings;
import buzzscope.model.service.monitor.MonitorSettings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads the {@code buzzscope} block of {@code config/buzzscope.conf}, or of
 * {@code application.conf} on the classpath when that file is absent.
 */
public class AppConfig {
    public static final String LOCAL_FILE = "config/buzzscope.conf";

    public final Path dataDir;
    public final CollectSettings collect;
    public final Analysis analysis;
    public final MonitorSettings monitor;
    public final Path notificationsFile;
    public final CollectorSettings platforms;

    private AppConfig(Path dataDir, CollectSettings collect, Analysis analysis, MonitorSettings monitor,
                      Path notificationsFile, CollectorSettings platforms) {
        this.dataDir = dataDir;
        this.collect = collect;
        this.analysis = analysis;
        this.monitor = monitor;
        this.notificationsFile = notificationsFile;
        this.platforms = platforms;
    }

    public static AppConfig load() {
        File f = new File(LOCAL_FILE);
        Config root = f.exists()
                ? ConfigFactory.parseFile(f).withFallback(ConfigFactory.load()).resolve()
                : ConfigFactory.load();
        return from(root);
    }

    /** @throws ConfigException when a key is missing or has the wrong type */
    public static AppConfig from(Config root) {
        Config b = root.getConfig("buzzscope");
        Path dataDir = Path.of(b.getString("data-dir"));

        Config c = b.getConfig("collect");
        CollectSettings collect = new CollectSettings(
                b.getDuration("cache.max-age"),
                c.getInt("historical-limit"),
                c.getInt("hot-limit"),
                c.getDuration("retry-backoff"),
                c.getDuration("platform-timeout"),
                c.getDuration("overall-timeout"),
                c.getInt("worker-threads"));

        Config a = b.getConfig("analysis");
        Analysis analysis = new Analysis(bucket(a, "bucket"), a.getInt("top-contributors"), a.getInt("sample-posts"));

        Config m = b.getConfig("monitor");
        MonitorSettings monitor = new MonitorSettings(
                m.getStringList("keywords"),
                platforms(m, "platforms"),
                policy(m, "policy"),
                m.getDuration("interval"),
                m.getDuration("retention"),
                m.getBoolean("force-refresh"));
        Path notifications = dataDir.resolve(m.getString("jsonl-file"));

        Config p = b.getConfig("platforms");
        CollectorSettings collectors = new CollectorSettings(
                new LinkedHashSet<>(platforms(p, "enabled")),
                p.getString("user-agent"),
                p.getDuration("http-timeout"),
                p.hasPath("youtube.api-key") ? p.getString("youtube.api-key") : null,
                Path.of(p.getString("discord.archive-dir")));

        return new AppConfig(dataDir, collect, analysis, monitor, notifications, collectors);
    }

    public Path cacheDir() { return dataDir.resolve("cache"); }
    public Path notifiedFile() { return dataDir.resolve("notified.json"); }
    public Path keywordsFile() { return dataDir.resolve("keywords.json"); }

    public static class Analysis {
        public final Bucket bucket;
        public final int topContributors;
        public final int samplePosts;
        public Analysis(Bucket bucket, int topContributors, int samplePosts) {
            this.bucket = bucket;
            this.topContributors = topContributors;
            this.samplePosts = samplePosts;
        }
    }

    private static List<Platform> platforms(Config c, String path) {
        List<Platform> out = new ArrayList<>();
        for (String s : c.getStringList(path)) {
            try {
                out.add(Platform.fromId(s));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(c.origin(), path, e.getMessage(), e);
            }
        }
        return out;
    }

    private static MatchPolicy policy(Config c, String path) {
        try {
            return MatchPolicy.fromId(c.getString(path));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), path, e.getMessage(), e);
        }
    }

    private static Bucket bucket(Config c, String path) {
        try {
            return Bucket.fromId(c.getString(path));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), path, e.getMessage(), e);
        }
    }
}
