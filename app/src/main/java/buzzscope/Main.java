package buzzscope;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.model.domain.*;
import buzzscope.model.repository.CacheStats;
import buzzscope.model.service.TrackingService;
import buzzscope.model.service.collect.NoPlatformAvailableException;
import buzzscope.model.service.config.AppConfig;
import buzzscope.model.service.monitor.CheckResult;

import java.io.PrintStream;
import java.util.*;

/**
 * Console launcher.
 * <pre>
 *   collect &lt;keyword&gt; [--platforms hackernews,reddit] [--mode historical|hot] [--policy exact|fuzzy] [--refresh]
 *   stats
 *   evict &lt;keyword&gt;
 *   monitor [--once]
 *   keywords add &lt;keyword&gt; [--platforms ...] | keywords remove &lt;keyword&gt; | keywords list
 * </pre>
 */
public final class Main {
    private static final Set<String> SWITCHES = Set.of("--refresh", "--once");

    private Main() {}

    public static void main(String[] args) throws Exception {
        AppConfig cfg = AppConfig.load();
        int code;
        try (TrackingService svc = TrackingService.createDefault(cfg)) {
            code = run(args, svc, cfg, System.out);
        }
        if (code != 0) System.exit(code);
    }

    static int run(String[] argv, TrackingService svc, AppConfig cfg, PrintStream out) throws Exception {
        Args a = Args.parse(argv);
        if (a.positional.isEmpty()) {
            usage(out);
            return 2;
        }
        String cmd = a.positional.get(0);
        try {
            switch (cmd) {
                case "collect" -> collect(a, svc, cfg, out);
                case "stats" -> stats(svc.cacheStats(), out);
                case "evict" -> out.println("[Cache] removed " + svc.evict(a.arg(1, "keyword")) + " entries");
                case "monitor" -> monitor(a, svc, out);
                case "keywords" -> keywords(a, svc, cfg, out);
                default -> {
                    usage(out);
                    return 2;
                }
            }
        } catch (IllegalArgumentException e) {
            out.println("[Error] " + e.getMessage());
            return 2;
        } catch (NoPlatformAvailableException e) {
            out.println("[Error] " + e.getMessage());
            return 1;
        }
        return 0;
    }

    /* ---------- Commands ---------- */

    private static void collect(Args a, TrackingService svc, AppConfig cfg, PrintStream out) throws Exception {
        String keyword = a.arg(1, "keyword");
        List<Platform> platforms = a.platforms(Arrays.stream(Platform.values())
                .filter(cfg.platforms.enabled()::contains).toList());
        Mode mode = Mode.fromId(a.opt("--mode", "historical"));
        MatchPolicy policy = MatchPolicy.fromId(a.opt("--policy", "exact"));

        CollectionResult r = svc.collect(keyword, platforms, mode, policy, a.has("--refresh"));
        out.println("[Collect] '" + r.keyword().normalized() + "' mode=" + mode.id() + " policy=" + policy);
        for (PlatformResult p : r.platforms().values()) {
            out.printf("  %-10s %-9s posts=%-5d %s%n", p.platform().id(), p.status(), p.postCount(),
                    p.status() == PlatformResult.Status.FAILED
                            ? p.error() + " " + p.reason()
                            : p.sourceLabel() + " @ " + p.collectedAt());
        }
        r.allWarnings().forEach(w -> out.println("  ! " + w));

        Metrics m = svc.analyze(r);
        out.println("[Metrics] mentions=" + m.totalMentions() + " authors=" + m.uniqueAuthors()
                + " interactions=" + m.totalInteractions());
        if (m.firstMention() != null) {
            out.println("  range " + m.firstMention() + " .. " + m.lastMention());
        }
        TrendSummary s = m.summary();
        out.println("  trend " + s.direction()
                + (s.changeRatio() == null ? "" : String.format(Locale.ROOT, " (%+.1f%%)", s.changeRatio() * 100))
                + (s.peakStart() == null ? "" : ", peak " + s.peakMentions() + " on " + s.peakStart()));
        m.perPlatform().forEach(p -> out.println("  " + p.platform().id() + ": " + p.mentions()
                + " mentions, " + p.uniqueAuthors() + " authors, " + p.interactions() + " interactions"));
        int rank = 1;
        for (Contributor c : m.topContributors()) {
            out.println("  #" + rank++ + " " + c.author() + " (" + c.mentions() + ")");
        }
        for (Post p : m.samplePosts()) {
            out.println("  * [" + p.platform().id() + "] " + (p.title() != null ? p.title() : abbreviate(p.body()))
                    + " (" + p.interactionCount() + ")");
        }
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= 80 ? flat : flat.substring(0, 77) + "...";
    }

    private static void stats(CacheStats s, PrintStream out) {
        out.println("[Cache] entries=" + s.totalEntries() + " posts=" + s.totalPosts()
                + " corrupt=" + s.corruptEntries() + " last=" + (s.lastCollectedAt() == null ? "never" : s.lastCollectedAt()));
        for (Platform p : Platform.values()) {
            CacheStats.PlatformStats ps = s.platforms().get(p);
            if (ps == null) continue;
            out.println("  " + p.id() + ": entries=" + ps.entries() + " keywords=" + ps.keywordCount()
                    + " posts=" + ps.posts() + " last=" + ps.lastCollectedAt()
                    + (ps.oldestPost() == null ? "" : " range=" + ps.oldestPost() + ".." + ps.newestPost()));
            ps.keywords().forEach((k, ks) ->
                    out.println("    " + k + ": entries=" + ks.entries() + " posts=" + ks.posts()));
        }
    }

    private static void monitor(Args a, TrackingService svc, PrintStream out) throws Exception {
        if (a.has("--once")) {
            CheckResult r = svc.monitor().runCycle();
            out.println("[Monitor] " + r.events().size() + " new events " + r.perKeyword());
            r.warnings().forEach(w -> out.println("  ! " + w));
            return;
        }
        svc.monitor().start();
        out.println("[Monitor] running, Ctrl+C to stop");
        Thread.currentThread().join();
    }

    private static void keywords(Args a, TrackingService svc, AppConfig cfg, PrintStream out) throws Exception {
        String sub = a.arg(1, "add|remove|list");
        switch (sub) {
            case "add" -> {
                TrackedKeyword k = svc.keywords().add(a.arg(2, "keyword"), a.platforms(cfg.monitor.platforms()));
                out.println("[Keywords] tracking '" + k.keyword() + "' on " + k.platforms());
            }
            case "remove" -> {
                String k = a.arg(2, "keyword");
                out.println(svc.keywords().remove(k) ? "[Keywords] removed '" + k + "'" : "[Keywords] not tracked: " + k);
            }
            case "list" -> {
                List<TrackedKeyword> all = svc.keywords().list();
                if (all.isEmpty()) out.println("[Keywords] none, monitor uses " + cfg.monitor.keywords());
                for (TrackedKeyword k : all) {
                    out.println("  " + k.keyword() + (k.enabled() ? "" : " (disabled)") + " " + k.platforms()
                            + " last analyzed " + (k.lastAnalyzed() == null ? "never" : k.lastAnalyzed()));
                }
            }
            default -> throw new IllegalArgumentException("unknown keywords command: " + sub);
        }
    }

    private static void usage(PrintStream out) {
        out.println("usage: buzzscope <command>");
        out.println("  collect <keyword> [--platforms a,b] [--mode historical|hot] [--policy exact|fuzzy] [--refresh]");
        out.println("  stats");
        out.println("  evict <keyword>");
        out.println("  monitor [--once]");
        out.println("  keywords add <keyword> [--platforms a,b] | remove <keyword> | list");
    }

    /* ---------- Args ---------- */

    static final class Args {
        final List<String> positional = new ArrayList<>();
        final Map<String, String> options = new LinkedHashMap<>();

        static Args parse(String[] argv) {
            Args a = new Args();
            for (int i = 0; i < argv.length; i++) {
                String s = argv[i];
                if (!s.startsWith("--")) { a.positional.add(s); continue; }
                if (SWITCHES.contains(s) || i + 1 >= argv.length) { a.options.put(s, ""); continue; }
                a.options.put(s, argv[++i]);
            }
            return a;
        }

        String arg(int i, String name) {
            if (positional.size() <= i) throw new IllegalArgumentException("missing <" + name + ">");
            return positional.get(i);
        }

        boolean has(String opt) { return options.containsKey(opt); }

        String opt(String opt, String def) { return options.getOrDefault(opt, def); }

        List<Platform> platforms(List<Platform> def) {
            String v = options.get("--platforms");
            if (v == null || v.isBlank()) return def;
            List<Platform> out = new ArrayList<>();
            for (String s : v.split(",")) if (!s.isBlank()) out.add(Platform.fromId(s.trim()));
            return out;
        }
    }
}
