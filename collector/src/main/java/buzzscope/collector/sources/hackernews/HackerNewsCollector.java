package buzzscope.collector.sources.hackernews;

import buzzscope.collector.core.*;
import buzzscope.collector.util.HttpUtil;
import buzzscope.collector.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Hacker News through the Algolia search API. Historical mode is a full-text
 * search over stories and comments, hot mode is the current front page.
 */
public final class HackerNewsCollector implements PlatformCollector {
    private static final Logger log = LoggerFactory.getLogger(HackerNewsCollector.class);

    static final String BASE = "https://hn.algolia.com/api/v1/search";
    private static final int MAX_HITS_PER_PAGE = 1000;
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private final CollectorSettings settings;

    public HackerNewsCollector(CollectorSettings settings) {
        this.settings = settings;
    }

    @Override public Platform platform() { return Platform.HACKERNEWS; }
    @Override public String name() { return "Hacker News (algolia)"; }

    @Override public String sourceLabel(Mode mode) {
        return mode == Mode.HOT ? SourceLabels.HOT_LISTING : SourceLabels.HISTORICAL_ARCHIVE;
    }

    @Override
    public List<RawRecord> fetch(String keyword, Mode mode, int limit) throws CollectorException {
        String url = buildUrl(keyword, mode, limit);
        String json = HttpUtil.get(url, settings.userAgent(), settings.httpTimeout());
        List<RawRecord> out = parse(JsonUtil.readTree(json));
        log.debug("[HackerNews] {} '{}' -> {} hits", mode.id(), keyword, out.size());
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    static String buildUrl(String keyword, Mode mode, int limit) {
        int hits = Math.max(1, Math.min(MAX_HITS_PER_PAGE, limit));
        if (mode == Mode.HOT) {
            return BASE + "?tags=front_page&hitsPerPage=" + hits;
        }
        return BASE + "?query=" + HttpUtil.enc(keyword)
                + "&tags=" + HttpUtil.enc("(story,comment)")
                + "&hitsPerPage=" + hits;
    }

    static List<RawRecord> parse(JsonNode root) {
        JsonNode hits = root.path("hits");
        if (!hits.isArray()) return List.of();

        List<RawRecord> out = new ArrayList<>();
        for (JsonNode h : hits) {
            String id = JsonUtil.text(h, "objectID");
            if (id == null) continue;

            String body = JsonUtil.text(h, "story_text");
            if (body == null) body = JsonUtil.text(h, "comment_text");

            String url = JsonUtil.text(h, "url");
            if (url == null) url = "https://news.ycombinator.com/item?id=" + id;

            JsonNode created = h.get("created_at_i");
            String createdAt = created != null && created.isNumber()
                    ? created.asText()
                    : JsonUtil.text(h, "created_at");

            Map<String, Long> counters = new LinkedHashMap<>();
            counters.put("score", JsonUtil.number(h, "points"));
            counters.put("descendants", JsonUtil.number(h, "num_comments"));

            out.add(new RawRecord(id, JsonUtil.text(h, "title"), stripHtml(body),
                    JsonUtil.text(h, "author"), createdAt, url, counters));
        }
        return out;
    }

    static String stripHtml(String html) {
        if (html == null) return null;
        String s = TAG.matcher(html.replace("<p>", "\n")).replaceAll("");
        return s.replace("&quot;", "\"").replace("&#x27;", "'").replace("&#x2F;", "/")
                .replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&")
                .trim();
    }
}
