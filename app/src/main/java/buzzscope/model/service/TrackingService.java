package buzzscope.model.service;

import buzzscope.collector.api.CollectorRegistry;
import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.collector.core.PlatformCollector;
import buzzscope.model.domain.*;
import buzzscope.model.repository.*;
import buzzscope.model.service.analysis.AnalysisEngine;
import buzzscope.model.service.collect.CollectionException;
import buzzscope.model.service.collect.CollectionOrchestrator;
import buzzscope.model.service.config.AppConfig;
import buzzscope.model.service.match.MatchEngine;
import buzzscope.model.service.monitor.EventMonitor;
import buzzscope.model.service.monitor.JsonlNotificationSink;
import buzzscope.model.service.monitor.LoggingNotificationSink;
import buzzscope.model.service.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Entry point for callers: collect, analyze, inspect the cache, monitor. */
public class TrackingService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

    /* ---------- Factory ---------- */

    public static TrackingService createDefault(AppConfig cfg) throws IOException {
        return create(cfg, CollectorRegistry.build(cfg.platforms), Clock.systemUTC());
    }

    public static TrackingService create(AppConfig cfg, Map<Platform, PlatformCollector> collectors, Clock clock)
            throws IOException {
        Files.createDirectories(cfg.dataDir);
        log.info("[Service] data dir = {}", cfg.dataDir.toAbsolutePath());

        CacheStore cache = new FileCacheStore(cfg.cacheDir(), clock);
        MatchEngine matcher = new MatchEngine();
        CollectionOrchestrator orchestrator = new CollectionOrchestrator(
                collectors, cache, new RecordNormalizer(), matcher, cfg.collect, clock);
        AnalysisEngine analysis = new AnalysisEngine(cfg.analysis.bucket, cfg.analysis.topContributors,
                cfg.analysis.samplePosts, matcher);
        KeywordRegistry registry = new KeywordRegistry(cfg.keywordsFile(), clock);

        EventMonitor monitor = new EventMonitor(
                orchestrator,
                new NotifiedStore(cfg.notifiedFile()),
                List.of(new LoggingNotificationSink(), new JsonlNotificationSink(cfg.notificationsFile)),
                cfg.monitor,
                registry::enabled,
                clock);
        return new TrackingService(cache, orchestrator, analysis, registry, monitor, clock);
    }

    /* ---------- Fields ---------- */

    private final CacheStore cache;
    private final CollectionOrchestrator orchestrator;
    private final AnalysisEngine analysis;
    private final KeywordRegistry registry;
    private final EventMonitor monitor;
    private final Clock clock;

    public TrackingService(CacheStore cache,
                           CollectionOrchestrator orchestrator,
                           AnalysisEngine analysis,
                           KeywordRegistry registry,
                           EventMonitor monitor,
                           Clock clock) {
        this.cache = cache;
        this.orchestrator = orchestrator;
        this.analysis = analysis;
        this.registry = registry;
        this.monitor = monitor;
        this.clock = clock;
    }

    /* ---------- Public API ---------- */

    public CollectionResult collect(String keyword, Collection<Platform> platforms, Mode mode,
                                    MatchPolicy policy, boolean forceRefresh) throws CollectionException {
        CollectionResult r = orchestrator.collect(keyword, platforms, mode, policy, forceRefresh);
        try {
            registry.markAnalyzed(r.keyword().normalized(), clock.instant());
        } catch (IOException e) {
            log.warn("[Service] cannot update keyword registry: {}", e.getMessage());
        }
        return r;
    }

    public Metrics analyze(List<Post> matchedPosts) { return analysis.analyze(matchedPosts); }

    public Metrics analyze(CollectionResult result) { return analysis.analyze(result); }

    public Metrics analyzeCached(String keyword, Collection<Platform> platforms, Mode mode, MatchPolicy policy) {
        return analysis.analyzeCached(cache, keyword, platforms, mode, policy);
    }

    public CacheStats cacheStats() { return cache.stats(); }

    public int evict(String keyword) throws CacheException { return cache.evict(keyword); }

    public EventMonitor monitor() { return monitor; }

    public KeywordRegistry keywords() { return registry; }

    @Override public void close() {
        monitor.close();
        orchestrator.close();
    }
}
