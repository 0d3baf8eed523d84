package buzzscope.model.repository;

import buzzscope.collector.core.Platform;
import buzzscope.model.domain.Keyword;
import buzzscope.model.domain.TrackedKeyword;
import buzzscope.util.AtomicFiles;
import buzzscope.util.Jsons;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Keywords the user tracks, kept in one JSON file. Every mutation is written
 * through; when the write fails the in-memory view is left unchanged.
 */
public class KeywordRegistry {
    private static final Logger log = LoggerFactory.getLogger(KeywordRegistry.class);
    private static final TypeReference<List<TrackedKeyword>> LIST = new TypeReference<>() {};

    private final Path file;
    private final Clock clock;
    private final ObjectMapper om = Jsons.mapper();
    private final Map<String, TrackedKeyword> entries = new LinkedHashMap<>();

    public KeywordRegistry(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        if (Files.exists(file)) {
            for (TrackedKeyword k : om.readValue(Files.readAllBytes(file), LIST)) {
                entries.putIfAbsent(k.keyword(), k);
            }
        }
    }

    public KeywordRegistry(Path file) throws IOException { this(file, Clock.systemUTC()); }

    public synchronized TrackedKeyword add(String keyword, Collection<Platform> platforms) throws IOException {
        String norm = Keyword.normalize(keyword);
        if (platforms == null || platforms.isEmpty()) {
            throw new IllegalArgumentException("at least one platform is required for '" + norm + "'");
        }
        if (entries.containsKey(norm)) {
            throw new IllegalArgumentException("keyword already tracked: " + norm);
        }
        TrackedKeyword k = new TrackedKeyword(norm, List.copyOf(new LinkedHashSet<>(platforms)), true, clock.instant(), null);
        Map<String, TrackedKeyword> next = new LinkedHashMap<>(entries);
        next.put(norm, k);
        commit(next);
        log.info("[Keywords] added '{}' on {}", norm, k.platforms());
        return k;
    }

    public synchronized boolean remove(String keyword) throws IOException {
        Map<String, TrackedKeyword> next = new LinkedHashMap<>(entries);
        if (next.remove(Keyword.normalize(keyword)) == null) return false;
        commit(next);
        return true;
    }

    public synchronized boolean setEnabled(String keyword, boolean enabled) throws IOException {
        return update(keyword, k -> k.withEnabled(enabled));
    }

    public synchronized boolean markAnalyzed(String keyword, Instant at) throws IOException {
        return update(keyword, k -> k.withLastAnalyzed(at));
    }

    public synchronized Optional<TrackedKeyword> find(String keyword) {
        return Optional.ofNullable(entries.get(Keyword.normalize(keyword)));
    }

    public synchronized List<TrackedKeyword> list() {
        return List.copyOf(entries.values());
    }

    public synchronized List<TrackedKeyword> enabled() {
        return entries.values().stream().filter(TrackedKeyword::enabled).toList();
    }

    private boolean update(String keyword, java.util.function.UnaryOperator<TrackedKeyword> f) throws IOException {
        String norm = Keyword.normalize(keyword);
        TrackedKeyword k = entries.get(norm);
        if (k == null) return false;
        Map<String, TrackedKeyword> next = new LinkedHashMap<>(entries);
        next.put(norm, f.apply(k));
        commit(next);
        return true;
    }

    /** Writes {@code next} and only then makes it the current view. */
    private void commit(Map<String, TrackedKeyword> next) throws IOException {
        AtomicFiles.write(file, om.writeValueAsBytes(new ArrayList<>(next.values())));
        entries.clear();
        entries.putAll(next);
    }
}
