package buzzscope.model.domain;

import buzzscope.collector.core.Mode;
import buzzscope.collector.core.Platform;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/** Identity of one cache entry. */
public record CacheKey(Platform platform, String keyword, Mode mode) {
    private static final int SLUG_MAX = 40;

    public CacheKey {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(mode, "mode");
        keyword = Keyword.normalize(keyword);
    }

    public static CacheKey of(Platform platform, Keyword keyword, Mode mode) {
        return new CacheKey(platform, keyword.normalized(), mode);
    }

    /**
     * {@code <platform>/<mode>/<slug>-<sha1 prefix>.json}. The hash keeps keywords
     * whose slugs collide ("c++" and "c#") apart.
     */
    public String relativePath() {
        return platform.id() + "/" + mode.id() + "/" + slug(keyword) + "-" + sha1(keyword).substring(0, 12) + ".json";
    }

    static String slug(String keyword) {
        String s = keyword.replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        if (s.isEmpty()) s = "kw";
        return s.length() > SLUG_MAX ? s.substring(0, SLUG_MAX) : s;
    }

    private static String sha1(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }
}
