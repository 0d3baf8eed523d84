package buzzscope.model.service.collect;

import buzzscope.collector.core.*;
import buzzscope.model.domain.*;
import buzzscope.model.repository.CacheException;
import buzzscope.model.repository.CacheLookup;
import buzzscope.model.repository.CacheStore;
import buzzscope.model.service.match.MatchEngine;
import buzzscope.model.service.normalize.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects one keyword from several platforms in parallel. Each platform runs
 * cache lookup, fetch, normalize and cache write in sequence on a worker; a
 * failing platform only degrades the result.
 */
public class CollectionOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CollectionOrchestrator.class);

    private final Map<Platform, PlatformCollector> collectors;
    private final CacheStore cache;
    private final RecordNormalizer normalizer;
    private final MatchEngine matcher;
    private final CollectSettings settings;
    private final Clock clock;
    private final ExecutorService pool;

    public CollectionOrchestrator(Map<Platform, PlatformCollector> collectors,
                                  CacheStore cache,
                                  RecordNormalizer normalizer,
                                  MatchEngine matcher,
                                  CollectSettings settings,
                                  Clock clock) {
        this.collectors = Map.copyOf(collectors);
        this.cache = cache;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.settings = settings;
        this.clock = clock;
        this.pool = Executors.newFixedThreadPool(settings.workerThreads(), workerFactory());
    }

    public CollectSettings settings() { return settings; }

    public Set<Platform> registeredPlatforms() { return collectors.keySet(); }

    /* ---------- Public API ---------- */

    public CollectionResult collect(String rawKeyword,
                                    Collection<Platform> platforms,
                                    Mode mode,
                                    MatchPolicy policy,
                                    boolean forceRefresh) throws CollectionException {
        Keyword keyword = Keyword.of(rawKeyword);
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(policy, "policy");
        if (platforms == null || platforms.isEmpty()) throw new IllegalArgumentException("no platforms requested");
        List<Platform> order = List.copyOf(new LinkedHashSet<>(platforms));

        long startNanos = System.nanoTime();
        long overallDeadline = startNanos + settings.overallTimeout().toNanos();

        Map<Platform, FetchTicket> tickets = new EnumMap<>(Platform.class);
        Map<Platform, Future<PlatformResult>> futures = new EnumMap<>(Platform.class);
        for (Platform p : order) {
            FetchTicket t = new FetchTicket();
            tickets.put(p, t);
            futures.put(p, pool.submit(() -> runUnit(p, keyword, mode, forceRefresh, t)));
        }

        Map<Platform, PlatformResult> results = new LinkedHashMap<>();
        try {
            for (Platform p : order) {
                long deadline = Math.min(startNanos + settings.perPlatformTimeout().toNanos(), overallDeadline);
                results.put(p, await(p, futures.get(p), tickets.get(p), deadline));
            }
        } catch (InterruptedException e) {
            tickets.values().forEach(FetchTicket::abandon);
            futures.values().forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CollectionException("interrupted while collecting '" + keyword.normalized() + "'", e);
        }

        List<Post> matched = new ArrayList<>();
        for (PlatformResult r : results.values()) {
            matched.addAll(matcher.filter(r.posts(), keyword.normalized(), policy));
        }

        CollectionResult result = new CollectionResult(keyword, mode, policy, results, matched, List.of());
        log.info("[Collect] '{}' {} {}: {} matched in {} ms ({})", keyword.normalized(), mode.id(), policy,
                matched.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), summary(results));
        if (!result.anyUsable()) throw new NoPlatformAvailableException(result);
        return result;
    }

    @Override public void close() {
        pool.shutdownNow();
    }

    /* ---------- Per platform ---------- */

    private PlatformResult await(Platform p, Future<PlatformResult> f, FetchTicket ticket, long deadlineNanos)
            throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            return f.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!ticket.abandon()) {
                // already wrote its cache entry, the result is about to arrive
                return awaitCommitted(p, f);
            }
            f.cancel(true);
            log.warn("[Collect] {} timed out", p.id());
            return PlatformResult.failed(p, CollectorError.NETWORK_ERROR, "timed out", List.of());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("[Collect] {} unit crashed", p.id(), cause);
            return PlatformResult.failed(p, CollectorError.NETWORK_ERROR, "unexpected failure: " + cause, List.of());
        } catch (CancellationException e) {
            return PlatformResult.failed(p, CollectorError.NETWORK_ERROR, "cancelled", List.of());
        }
    }

    private PlatformResult awaitCommitted(Platform p, Future<PlatformResult> f) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException | CancellationException e) {
            return PlatformResult.failed(p, CollectorError.NETWORK_ERROR, "unexpected failure: " + e, List.of());
        }
    }

    private PlatformResult runUnit(Platform p, Keyword keyword, Mode mode, boolean force, FetchTicket ticket) {
        CacheKey key = CacheKey.of(p, keyword, mode);
        List<String> warnings = new ArrayList<>();

        if (!force) {
            CacheLookup lookup = cache.lookup(key);
            if (lookup.isCorrupt()) {
                warnings.add("corrupt cache entry ignored: " + lookup.diagnostic());
            } else if (lookup.isHit()) {
                if (!cache.isStale(lookup.entry(), settings.cacheMaxAge())) {
                    return PlatformResult.cacheHit(p, lookup.entry(), warnings);
                }
                log.debug("[Collect] {} cache entry from {} is stale", p.id(), lookup.entry().collectedAt());
            }
        }

        PlatformCollector collector = collectors.get(p);
        if (collector == null) {
            return PlatformResult.failed(p, CollectorError.NOT_SUPPORTED, "no collector registered for " + p.id(), warnings);
        }

        List<RawRecord> raw;
        try {
            raw = fetchWithRetry(collector, keyword.normalized(), mode, ticket);
        } catch (CollectorException e) {
            log.warn("[Collect] {} failed: {} {}", p.id(), e.error(), e.getMessage());
            return PlatformResult.failed(p, e.error(), e.getMessage(), warnings);
        }

        List<Post> posts = normalizer.normalizeAll(raw, p);
        String label = collector.sourceLabel(mode);
        Instant at = clock.instant();
        try {
            if (!ticket.commit(() -> cache.put(key, posts, label))) {
                return PlatformResult.failed(p, CollectorError.NETWORK_ERROR, "abandoned", warnings);
            }
        } catch (CacheException e) {
            log.warn("[Collect] {} cache write failed: {}", p.id(), e.getMessage());
            warnings.add("results not cached: " + e.getMessage());
        }
        return PlatformResult.success(p, posts, label, at, warnings);
    }

    private List<RawRecord> fetchWithRetry(PlatformCollector c, String keyword, Mode mode, FetchTicket ticket)
            throws CollectorException {
        int limit = settings.limitFor(mode);
        try {
            return fetchOnce(c, keyword, mode, limit);
        } catch (CollectorException first) {
            if (!first.error().retryable() || ticket.isAbandoned()) throw first;
            log.info("[Collect] {} {}, retrying once in {} ms", c.platform().id(), first.error(),
                    settings.retryBackoff().toMillis());
            try {
                Thread.sleep(settings.retryBackoff().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CollectorException(CollectorError.NETWORK_ERROR, "interrupted before retry", e);
            }
            return fetchOnce(c, keyword, mode, limit);
        }
    }

    private static List<RawRecord> fetchOnce(PlatformCollector c, String keyword, Mode mode, int limit)
            throws CollectorException {
        try {
            List<RawRecord> out = c.fetch(keyword, mode, limit);
            return out == null ? List.of() : out;
        } catch (RuntimeException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR, "unexpected collector failure: " + e, e);
        }
    }

    private static String summary(Map<Platform, PlatformResult> results) {
        StringJoiner j = new StringJoiner(", ");
        results.forEach((p, r) -> j.add(p.id() + "=" + r.status() + "/" + r.postCount()));
        return j.toString();
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "collect-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
