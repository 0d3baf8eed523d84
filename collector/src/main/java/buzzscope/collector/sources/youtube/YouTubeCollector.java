package buzzscope.collector.sources.youtube;

import buzzscope.collector.core.*;
import buzzscope.collector.util.HttpUtil;
import buzzscope.collector.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * YouTube Data API v3. Search results carry no statistics, so video ids are
 * resolved through {@code videos?part=snippet,statistics} in batches of 50.
 */
public final class YouTubeCollector implements PlatformCollector {
    private static final Logger log = LoggerFactory.getLogger(YouTubeCollector.class);

    private static final String API = "https://www.googleapis.com/youtube/v3";
    private static final int MAX_RESULTS = 50;
    private static final int DESCRIPTION_MAX = 1000;

    private final CollectorSettings settings;

    public YouTubeCollector(CollectorSettings settings) {
        this.settings = settings;
    }

    @Override public Platform platform() { return Platform.YOUTUBE; }
    @Override public String name() { return "YouTube Data API v3"; }

    @Override
    public List<RawRecord> fetch(String keyword, Mode mode, int limit) throws CollectorException {
        String apiKey = settings.youtubeApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new CollectorException(CollectorError.AUTH_INVALID, "Missing youtube api key");
        }
        List<RawRecord> out = mode == Mode.HOT
                ? mostPopular(apiKey, limit)
                : search(keyword, apiKey, limit);
        log.debug("[YouTube] {} '{}' -> {} videos", mode.id(), keyword, out.size());
        return out;
    }

    private List<RawRecord> search(String keyword, String apiKey, int limit) throws CollectorException {
        List<String> ids = new ArrayList<>();
        String pageToken = null;
        while (ids.size() < limit) {
            StringBuilder sb = new StringBuilder(API).append("/search?part=snippet&type=video&order=relevance");
            sb.append("&maxResults=").append(Math.min(MAX_RESULTS, limit - ids.size()));
            sb.append("&q=").append(HttpUtil.enc(keyword));
            if (pageToken != null) sb.append("&pageToken=").append(pageToken);
            sb.append("&key=").append(apiKey);

            JsonNode page = call(sb.toString());
            List<String> found = videoIds(page);
            if (found.isEmpty()) break;
            ids.addAll(found);
            pageToken = JsonUtil.text(page, "nextPageToken");
            if (pageToken == null) break;
        }

        List<RawRecord> out = new ArrayList<>();
        for (int i = 0; i < ids.size() && out.size() < limit; i += MAX_RESULTS) {
            List<String> batch = ids.subList(i, Math.min(ids.size(), i + MAX_RESULTS));
            String url = API + "/videos?part=snippet,statistics&id=" + String.join(",", batch) + "&key=" + apiKey;
            out.addAll(parseVideos(call(url)));
        }
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    private List<RawRecord> mostPopular(String apiKey, int limit) throws CollectorException {
        List<RawRecord> out = new ArrayList<>();
        String pageToken = null;
        while (out.size() < limit) {
            StringBuilder sb = new StringBuilder(API).append("/videos?part=snippet,statistics&chart=mostPopular");
            sb.append("&maxResults=").append(Math.min(MAX_RESULTS, limit - out.size()));
            if (pageToken != null) sb.append("&pageToken=").append(pageToken);
            sb.append("&key=").append(apiKey);

            JsonNode page = call(sb.toString());
            List<RawRecord> videos = parseVideos(page);
            if (videos.isEmpty()) break;
            out.addAll(videos);
            pageToken = JsonUtil.text(page, "nextPageToken");
            if (pageToken == null) break;
        }
        return out.size() > limit ? out.subList(0, limit) : out;
    }

    private JsonNode call(String url) throws CollectorException {
        return JsonUtil.readTree(HttpUtil.get(url, settings.userAgent(), settings.httpTimeout()));
    }

    static List<String> videoIds(JsonNode searchPage) {
        List<String> ids = new ArrayList<>();
        for (JsonNode it : searchPage.path("items")) {
            String vid = JsonUtil.text(it.path("id"), "videoId");
            if (vid != null) ids.add(vid);
        }
        return ids;
    }

    static List<RawRecord> parseVideos(JsonNode videosPage) {
        List<RawRecord> out = new ArrayList<>();
        for (JsonNode it : videosPage.path("items")) {
            String id = JsonUtil.text(it, "id");
            if (id == null) continue;
            JsonNode snippet = it.path("snippet");
            JsonNode stats = it.path("statistics");

            String description = JsonUtil.text(snippet, "description");
            if (description != null && description.length() > DESCRIPTION_MAX) {
                description = description.substring(0, DESCRIPTION_MAX);
            }

            Map<String, Long> counters = new LinkedHashMap<>();
            counters.put("view_count", JsonUtil.number(stats, "viewCount"));
            counters.put("like_count", JsonUtil.number(stats, "likeCount"));
            counters.put("comment_count", JsonUtil.number(stats, "commentCount"));

            out.add(new RawRecord(id,
                    JsonUtil.text(snippet, "title"),
                    description,
                    JsonUtil.text(snippet, "channelTitle"),
                    JsonUtil.text(snippet, "publishedAt"),
                    "https://www.youtube.com/watch?v=" + id,
                    counters));
        }
        return out;
    }
}
