package buzzscope.collector.sources.reddit;

import buzzscope.collector.core.*;
import buzzscope.collector.util.HttpUtil;
import com.google.gson.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reddit public JSON endpoints. Historical mode pages through a global
 * {@code t=all} search, hot mode reads {@code r/all/hot}.
 */
public final class RedditCollector implements PlatformCollector {
    private static final Logger log = LoggerFactory.getLogger(RedditCollector.class);

    private static final String BASE = "https://www.reddit.com";
    private static final int MAX_PAGE = 100;
    private static final int MAX_PAGES = 10;
    private static final long PAGE_PAUSE_MS = 600;

    private final CollectorSettings settings;

    public RedditCollector(CollectorSettings settings) {
        this.settings = settings;
    }

    @Override public Platform platform() { return Platform.REDDIT; }
    @Override public String name() { return "Reddit (json)"; }

    @Override
    public List<RawRecord> fetch(String keyword, Mode mode, int limit) throws CollectorException {
        List<RawRecord> out = new ArrayList<>();
        String after = null;
        for (int page = 0; page < MAX_PAGES && out.size() < limit; page++) {
            int pageSize = Math.min(MAX_PAGE, limit - out.size());
            String json = HttpUtil.get(buildUrl(keyword, mode, pageSize, after),
                    settings.userAgent(), settings.httpTimeout());

            Listing listing = parse(json);
            for (RawRecord r : listing.records()) {
                if (out.size() >= limit) break;
                out.add(r);
            }
            after = listing.after();
            if (after == null || listing.records().isEmpty()) break;
            pause();
        }
        log.debug("[Reddit] {} '{}' -> {} posts", mode.id(), keyword, out.size());
        return out;
    }

    static String buildUrl(String keyword, Mode mode, int pageSize, String after) {
        StringBuilder sb = new StringBuilder(BASE);
        if (mode == Mode.HOT) {
            sb.append("/r/all/hot.json?limit=").append(pageSize);
        } else {
            sb.append("/search.json?q=").append(HttpUtil.enc(keyword));
            sb.append("&sort=relevance&t=all&restrict_sr=0");
            sb.append("&limit=").append(pageSize);
        }
        if (after != null && !after.isBlank()) sb.append("&after=").append(after);
        return sb.toString();
    }

    record Listing(List<RawRecord> records, String after) {}

    static Listing parse(String json) throws CollectorException {
        JsonObject root;
        try {
            root = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR, "unparseable reddit listing", e);
        }
        JsonObject data = root.has("data") && root.get("data").isJsonObject()
                ? root.getAsJsonObject("data") : new JsonObject();
        JsonArray children = data.has("children") && data.get("children").isJsonArray()
                ? data.getAsJsonArray("children") : new JsonArray();

        List<RawRecord> out = new ArrayList<>();
        for (JsonElement e : children) {
            if (!e.isJsonObject()) continue;
            JsonObject ro = e.getAsJsonObject().getAsJsonObject("data");
            if (ro == null) continue;

            String id = sval(ro, "id");
            if (id == null) continue;

            String author = sval(ro, "author");
            if ("[deleted]".equals(author)) author = null;

            String permalink = sval(ro, "permalink");
            String url = permalink == null ? sval(ro, "url") : BASE + permalink;

            Map<String, Long> counters = new LinkedHashMap<>();
            counters.put("score", lval(ro, "score"));
            counters.put("num_comments", lval(ro, "num_comments"));

            out.add(new RawRecord(id, sval(ro, "title"), sval(ro, "selftext"), author,
                    sval(ro, "created_utc"), url, counters));
        }
        String after = sval(data, "after");
        return new Listing(out, after);
    }

    private static void pause() throws CollectorException {
        try {
            Thread.sleep(PAGE_PAUSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectorException(CollectorError.NETWORK_ERROR, "interrupted while paging", e);
        }
    }

    private static String sval(JsonObject o, String k) {
        if (o == null || !o.has(k) || o.get(k).isJsonNull()) return null;
        JsonElement v = o.get(k);
        if (v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber()) {
            // created_utc arrives as a float, e.g. 1700000000.0
            return Long.toString(v.getAsBigDecimal().longValue());
        }
        String s = v.getAsString();
        return s.isBlank() ? null : s;
    }

    private static long lval(JsonObject o, String k) {
        if (o == null || !o.has(k) || o.get(k).isJsonNull()) return 0L;
        try { return o.get(k).getAsLong(); }
        catch (NumberFormatException | UnsupportedOperationException e) { return 0L; }
    }
}
