package buzzscope.model.repository;

import buzzscope.model.domain.CacheEntry;
import buzzscope.model.domain.CacheKey;
import buzzscope.model.domain.Post;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable keyword results, one entry per {@link CacheKey}. Writes replace the
 * whole entry; there is no merging.
 */
public interface CacheStore {

    CacheLookup lookup(CacheKey key);

    default Optional<CacheEntry> get(CacheKey key) {
        return lookup(key).asOptional();
    }

    CacheEntry put(CacheKey key, List<Post> posts, String sourceLabel) throws CacheException;

    boolean isStale(CacheEntry entry, Duration maxAge);

    CacheStats stats();

    /** Normalized keywords with at least one entry. */
    Set<String> cachedKeywords();

    /** Removes every entry of a keyword across platforms and modes. Returns the number removed. */
    int evict(String keyword) throws CacheException;

    void clear() throws CacheException;
}
