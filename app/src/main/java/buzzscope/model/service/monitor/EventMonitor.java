package buzzscope.model.service.monitor;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.model.domain.*;
import buzzscope.model.repository.NotifiedStore;
import buzzscope.model.service.collect.CollectionException;
import buzzscope.model.service.collect.CollectionOrchestrator;
import buzzscope.model.service.collect.NoPlatformAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Polls hot listings for the monitored keywords and announces posts not seen
 * before. One check at a time: IDLE, CHECKING, then NOTIFYING or back to IDLE.
 */
public class EventMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventMonitor.class);

    private final CollectionOrchestrator orchestrator;
    private final NotifiedStore store;
    private final List<NotificationSink> sinks;
    private final MonitorSettings settings;
    private final Supplier<List<TrackedKeyword>> keywordSource;
    private final Clock clock;

    private final AtomicReference<MonitorPhase> phase = new AtomicReference<>(MonitorPhase.IDLE);
    private ScheduledExecutorService scheduler;

    /**
     * @param keywordSource tracked keywords in priority order, each checked on its
     *                      own platforms; when it yields nothing the keywords of
     *                      {@code settings} are used on the configured platforms
     */
    public EventMonitor(CollectionOrchestrator orchestrator,
                        NotifiedStore store,
                        List<NotificationSink> sinks,
                        MonitorSettings settings,
                        Supplier<List<TrackedKeyword>> keywordSource,
                        Clock clock) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.sinks = List.copyOf(sinks);
        this.settings = settings;
        this.keywordSource = keywordSource == null ? List::of : keywordSource;
        this.clock = clock;
    }

    public MonitorPhase phase() { return phase.get(); }

    /* ---------- One cycle ---------- */

    /**
     * Finds matched hot posts not in {@code previous}. Does not persist or deliver.
     *
     * @throws IllegalStateException when another check is running
     */
    public CheckResult check(NotifiedSet previous) throws MonitorException {
        enter();
        try {
            return doCheck(previous);
        } finally {
            phase.set(MonitorPhase.IDLE);
        }
    }

    /** Load, prune, check, persist, deliver. Nothing is delivered unless the new set was saved. */
    public CheckResult runCycle() throws MonitorException {
        enter();
        try {
            NotifiedSet previous;
            try {
                previous = store.load();
            } catch (IOException e) {
                throw new MonitorException("cannot load notified set from " + store.file(), e);
            }
            NotifiedSet pruned = previous.prunedBefore(clock.instant().minus(settings.retention()));
            if (pruned.size() != previous.size()) {
                log.debug("[Monitor] pruned {} old entries", previous.size() - pruned.size());
            }

            CheckResult result = doCheck(pruned);

            try {
                store.save(result.next());
            } catch (IOException e) {
                throw new MonitorException("cannot persist notified set to " + store.file(), e);
            }

            if (!result.events().isEmpty()) {
                phase.set(MonitorPhase.NOTIFYING);
                deliver(result.events());
            }
            log.info("[Monitor] cycle done: {} new events {}", result.events().size(), result.perKeyword());
            return result;
        } finally {
            phase.set(MonitorPhase.IDLE);
        }
    }

    /* ---------- Scheduling ---------- */

    public synchronized void start() { start(settings.interval()); }

    public synchronized void start(Duration interval) {
        if (scheduler != null) throw new IllegalStateException("monitor already started");
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "event-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledCycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[Monitor] started, every {}", interval);
    }

    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
        log.info("[Monitor] stopped");
    }

    public synchronized boolean isRunning() { return scheduler != null; }

    @Override public void close() { stop(); }

    private void scheduledCycle() {
        try {
            runCycle();
        } catch (MonitorException e) {
            log.error("[Monitor] cycle failed: {}", e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.warn("[Monitor] cycle skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            // an exception escaping here would cancel every later cycle
            log.error("[Monitor] unexpected failure", e);
        }
    }

    /* ---------- Internals ---------- */

    private void enter() {
        if (!phase.compareAndSet(MonitorPhase.IDLE, MonitorPhase.CHECKING)) {
            throw new IllegalStateException("a check is already running (" + phase.get() + ")");
        }
    }

    /** Normalized keyword to the platforms it is checked on, in priority order. */
    Map<String, List<Platform>> monitoredKeywords() {
        Map<String, List<Platform>> out = new LinkedHashMap<>();
        List<TrackedKeyword> tracked = keywordSource.get();
        if (tracked != null && !tracked.isEmpty()) {
            for (TrackedKeyword t : tracked) {
                out.putIfAbsent(t.keyword(), t.platforms().isEmpty() ? settings.platforms() : t.platforms());
            }
            return out;
        }
        for (String k : settings.keywords()) {
            if (k == null || k.isBlank()) continue;
            out.putIfAbsent(Keyword.normalize(k), settings.platforms());
        }
        return out;
    }

    private CheckResult doCheck(NotifiedSet previous) throws MonitorException {
        Instant now = clock.instant();
        List<NotificationEvent> events = new ArrayList<>();
        Map<NotifiedKey, Instant> added = new LinkedHashMap<>();
        Map<String, Integer> perKeyword = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, List<Platform>> entry : monitoredKeywords().entrySet()) {
            String keyword = entry.getKey();
            CollectionResult result;
            try {
                result = orchestrator.collect(keyword, entry.getValue(), Mode.HOT, settings.policy(),
                        settings.forceRefresh());
            } catch (NoPlatformAvailableException e) {
                log.warn("[Monitor] '{}' skipped: {}", keyword, e.getMessage());
                warnings.add(keyword + ": no platform available");
                perKeyword.put(keyword, 0);
                continue;
            } catch (CollectionException e) {
                throw new MonitorException("check interrupted at '" + keyword + "'", e);
            }

            result.platforms().values().stream()
                    .filter(r -> !r.usable())
                    .forEach(r -> {
                        log.warn("[Monitor] '{}' {} unavailable: {} {}", keyword, r.platform().id(), r.error(), r.reason());
                        warnings.add(keyword + ": " + r.platform().id() + " " + r.error());
                    });

            int n = 0;
            for (Post p : result.matched()) {
                NotifiedKey k = NotifiedKey.of(p);
                if (previous.contains(k) || added.containsKey(k)) continue;
                added.put(k, now);
                events.add(new NotificationEvent(keyword, p, now));
                n++;
            }
            perKeyword.put(keyword, n);
        }
        return new CheckResult(events, previous.plus(added), perKeyword, warnings);
    }

    private void deliver(List<NotificationEvent> events) {
        for (NotificationSink sink : sinks) {
            int failed = 0;
            for (NotificationEvent e : events) {
                try {
                    sink.deliver(e);
                } catch (IOException | RuntimeException ex) {
                    failed++;
                    log.warn("[Monitor] {} could not deliver {}/{}: {}", sink.getClass().getSimpleName(),
                            e.platform(), e.post().id(), ex.getMessage());
                }
            }
            if (failed > 0) log.warn("[Monitor] {} failed {} of {} events", sink.getClass().getSimpleName(), failed, events.size());
        }
    }
}
