package buzzscope.model.repository;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;
import buzzscope.model.domain.CacheEntry;
import buzzscope.model.domain.CacheKey;
import buzzscope.model.domain.Keyword;
import buzzscope.model.domain.Post;
import buzzscope.util.AtomicFiles;
import buzzscope.util.Jsons;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * One JSON document per key under {@code root}, at {@link CacheKey#relativePath()}.
 * Readers of a key share its lock, writers of a key take it exclusively; keys
 * never block each other.
 */
public class FileCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);

    private final Path root;
    private final Clock clock;
    private final ObjectMapper om = Jsons.mapper();
    private final ConcurrentHashMap<CacheKey, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public FileCacheStore(Path root) { this(root, Clock.systemUTC()); }

    public FileCacheStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    public Path root() { return root; }

    /* ---------- Reads ---------- */

    @Override public CacheLookup lookup(CacheKey key) {
        Path f = fileOf(key);
        ReadWriteLock lock = lockOf(key);
        lock.readLock().lock();
        try {
            return CacheLookup.hit(read(f, key));
        } catch (NoSuchFileException e) {
            return CacheLookup.miss();
        } catch (CacheException e) {
            log.warn("[Cache] {} ignored: {}", f, e.getMessage());
            return CacheLookup.corrupt(e.getMessage());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override public boolean isStale(CacheEntry entry, Duration maxAge) {
        return Duration.between(entry.collectedAt(), clock.instant()).compareTo(maxAge) > 0;
    }

    @Override public CacheStats stats() {
        Map<Platform, Tally> tallies = new EnumMap<>(Platform.class);
        Instant overall = null;
        int corrupt = 0;

        for (Path f : documents()) {
            CacheEntry e;
            try {
                e = read(f, null);
            } catch (NoSuchFileException gone) {
                continue; // evicted while walking
            } catch (CacheException ex) {
                corrupt++;
                continue;
            }
            tallies.computeIfAbsent(e.key().platform(), k -> new Tally()).add(e);
            overall = later(overall, e.collectedAt());
        }

        Map<Platform, CacheStats.PlatformStats> out = new EnumMap<>(Platform.class);
        tallies.forEach((p, t) -> out.put(p, t.toStats()));
        return new CacheStats(out, overall, corrupt);
    }

    private static Instant later(Instant a, Instant b) {
        return a == null || b.isAfter(a) ? b : a;
    }

    private static Instant earlier(Instant a, Instant b) {
        return a == null || b.isBefore(a) ? b : a;
    }

    /** Running per-platform totals for {@link #stats()}. */
    private static final class Tally {
        int entries;
        long posts;
        Instant lastCollected, oldestPost, newestPost;
        final Map<String, CacheStats.KeywordStats> keywords = new TreeMap<>();

        void add(CacheEntry e) {
            entries++;
            posts += e.posts().size();
            lastCollected = later(lastCollected, e.collectedAt());
            for (Post p : e.posts()) {
                oldestPost = earlier(oldestPost, p.timestamp());
                newestPost = later(newestPost, p.timestamp());
            }
            keywords.merge(e.key().keyword(),
                    new CacheStats.KeywordStats(1, e.posts().size(), e.collectedAt()),
                    (a, b) -> new CacheStats.KeywordStats(a.entries() + b.entries(), a.posts() + b.posts(),
                            later(a.lastCollectedAt(), b.lastCollectedAt())));
        }

        CacheStats.PlatformStats toStats() {
            return new CacheStats.PlatformStats(entries, keywords, posts, lastCollected, oldestPost, newestPost);
        }
    }

    @Override public Set<String> cachedKeywords() {
        Set<String> out = new TreeSet<>();
        for (Path f : documents()) {
            try {
                out.add(read(f, null).key().keyword());
            } catch (NoSuchFileException | CacheException e) {
                log.debug("[Cache] skipped {}: {}", f, e.getMessage());
            }
        }
        return out;
    }

    /* ---------- Writes ---------- */

    @Override public CacheEntry put(CacheKey key, List<Post> posts, String sourceLabel) throws CacheException {
        CacheEntry entry = new CacheEntry(key, posts, clock.instant(), sourceLabel, CacheEntry.FORMAT_VERSION);
        Path f = fileOf(key);
        ReadWriteLock lock = lockOf(key);
        lock.writeLock().lock();
        try {
            AtomicFiles.write(f, om.writeValueAsBytes(CacheDocument.of(entry)));
        } catch (IOException e) {
            throw new CacheException(CacheException.Kind.IO_FAILURE, "cannot write " + f + ": " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Cache] put {} ({} posts)", key.relativePath(), entry.posts().size());
        return entry;
    }

    @Override public int evict(String keyword) throws CacheException {
        String normalized = Keyword.normalize(keyword);
        int removed = 0;
        for (Platform p : Platform.values()) {
            for (Mode m : Mode.values()) {
                if (delete(new CacheKey(p, normalized, m))) removed++;
            }
        }
        log.info("[Cache] evicted '{}' ({} entries)", normalized, removed);
        return removed;
    }

    /** Deletes every document, each under its key's write lock. Unreadable documents are deleted as they are. */
    @Override public void clear() throws CacheException {
        int removed = 0;
        for (Path f : documents()) {
            CacheKey key = keyOf(f);
            try {
                if (key != null ? delete(key) : Files.deleteIfExists(f)) removed++;
            } catch (IOException e) {
                throw new CacheException(CacheException.Kind.IO_FAILURE, "cannot delete " + f, e);
            }
        }
        log.info("[Cache] cleared {} ({} entries)", root, removed);
    }

    /** Key a document was written for, or null when it cannot be read. */
    private CacheKey keyOf(Path f) {
        try {
            CacheKey key = read(f, null).key();
            return fileOf(key).equals(f) ? key : null;
        } catch (NoSuchFileException | CacheException e) {
            return null;
        }
    }

    private boolean delete(CacheKey key) throws CacheException {
        Path f = fileOf(key);
        ReadWriteLock lock = lockOf(key);
        lock.writeLock().lock();
        try {
            return Files.deleteIfExists(f);
        } catch (IOException e) {
            throw new CacheException(CacheException.Kind.IO_FAILURE, "cannot delete " + f, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /* ---------- Files ---------- */

    private Path fileOf(CacheKey key) {
        return root.resolve(key.relativePath());
    }

    private ReadWriteLock lockOf(CacheKey key) {
        return locks.computeIfAbsent(key, k -> new ReentrantReadWriteLock());
    }

    /**
     * Reads and validates a document. When {@code expected} is given the stored
     * key must equal it.
     */
    private CacheEntry read(Path f, CacheKey expected) throws NoSuchFileException, CacheException {
        CacheDocument doc;
        try {
            doc = om.readValue(Files.readAllBytes(f), CacheDocument.class);
        } catch (NoSuchFileException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new CacheException(CacheException.Kind.CORRUPT, "unreadable cache document: " + e.getMessage(), e);
        }
        CacheEntry entry = doc.toEntry();
        if (expected != null && !expected.equals(entry.key())) {
            throw new CacheException(CacheException.Kind.CORRUPT,
                    "document holds " + entry.key() + ", expected " + expected);
        }
        return entry;
    }

    private List<Path> documents() {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> walk = Files.walk(root, 3)) {
            return walk.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("[Cache] cannot list {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    /** On-disk shape of one entry. */
    record CacheDocument(
            Integer formatVersion,
            Platform platform,
            String keyword,
            Mode mode,
            Instant collectedAt,
            String sourceLabel,
            List<Post> posts
    ) {
        static CacheDocument of(CacheEntry e) {
            return new CacheDocument(e.formatVersion(), e.key().platform(), e.key().keyword(), e.key().mode(),
                    e.collectedAt(), e.sourceLabel(), e.posts());
        }

        CacheEntry toEntry() throws CacheException {
            if (formatVersion == null || formatVersion != CacheEntry.FORMAT_VERSION) {
                throw new CacheException(CacheException.Kind.CORRUPT, "unsupported formatVersion " + formatVersion);
            }
            if (platform == null || mode == null || keyword == null || keyword.isBlank() || collectedAt == null) {
                throw new CacheException(CacheException.Kind.CORRUPT, "incomplete cache document");
            }
            for (Post p : posts == null ? List.<Post>of() : posts) {
                if (p == null || p.platform() != platform) {
                    throw new CacheException(CacheException.Kind.CORRUPT, "post of another platform in " + platform + " entry");
                }
            }
            return new CacheEntry(new CacheKey(platform, keyword, mode), posts, collectedAt, sourceLabel, formatVersion);
        }
    }
}
