package buzzscope.model.repository;

import buzzscope.model.domain.CacheEntry;

import java.util.Optional;

/** Result of reading one key: a hit, a plain miss, or a miss caused by a corrupt document. */
public record CacheLookup(CacheEntry entry, String diagnostic) {

    public static CacheLookup hit(CacheEntry e) { return new CacheLookup(e, null); }
    public static CacheLookup miss() { return new CacheLookup(null, null); }
    public static CacheLookup corrupt(String diagnostic) { return new CacheLookup(null, diagnostic); }

    public boolean isHit() { return entry != null; }
    public boolean isCorrupt() { return diagnostic != null; }

    public Optional<CacheEntry> asOptional() { return Optional.ofNullable(entry); }
}
