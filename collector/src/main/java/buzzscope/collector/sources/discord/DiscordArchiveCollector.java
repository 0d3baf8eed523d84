package buzzscope.collector.sources.discord;

import buzzscope.collector.core.*;
import buzzscope.collector.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Discord has no search API we can use, only DiscordChatExporter dumps on disk
 * laid out as {@code <archiveDir>/<channel>/*.csv} or {@code *.json}. JSON dumps
 * may be a single-channel export ({@code {"messages": [...]}}), a bare message
 * list, or a guild export with {@code channels[].messages}. Historical mode
 * returns the whole archive; hot mode is not supported.
 */
public final class DiscordArchiveCollector implements PlatformCollector {
    private static final Logger log = LoggerFactory.getLogger(DiscordArchiveCollector.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setTrim(true)
            .build();
    private static final Pattern REACTION_COUNT = Pattern.compile("\\((\\d+)\\)");

    private final Path archiveDir;

    public DiscordArchiveCollector(CollectorSettings settings) {
        this(settings.discordArchiveDir());
    }

    public DiscordArchiveCollector(Path archiveDir) {
        this.archiveDir = archiveDir;
    }

    @Override public Platform platform() { return Platform.DISCORD; }
    @Override public String name() { return "Discord (export archive)"; }

    @Override public String sourceLabel(Mode mode) {
        return mode == Mode.HOT ? SourceLabels.HOT_LISTING : SourceLabels.HISTORICAL_ARCHIVE;
    }

    /** {@code limit} is ignored: the archive is returned whole. */
    @Override
    public List<RawRecord> fetch(String keyword, Mode mode, int limit) throws CollectorException {
        if (mode == Mode.HOT) throw CollectorException.notSupported(platform(), mode);
        if (archiveDir == null || !Files.isDirectory(archiveDir)) {
            log.info("[Discord] archive dir not found: {}", archiveDir);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(archiveDir, 2)) {
            files = walk.filter(p -> Files.isRegularFile(p) && isExport(p))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR, "cannot list archive " + archiveDir, e);
        }

        List<RawRecord> out = new ArrayList<>();
        for (Path f : files) {
            String channel = f.getParent().equals(archiveDir) ? "general" : f.getParent().getFileName().toString();
            try {
                out.addAll(readExport(f, channel));
            } catch (IOException | CollectorException | IllegalArgumentException | IllegalStateException e) {
                log.warn("[Discord] skipped unreadable export {}: {}", f, e.getMessage());
            }
        }
        log.debug("[Discord] {} messages from {} files", out.size(), files.size());
        return out;
    }

    private static boolean isExport(Path p) {
        String name = p.getFileName().toString();
        return name.endsWith(".csv") || name.endsWith(".json");
    }

    private static List<RawRecord> readExport(Path f, String channel) throws IOException, CollectorException {
        if (f.getFileName().toString().endsWith(".json")) {
            return parseJson(Files.readString(f, StandardCharsets.UTF_8), channel);
        }
        try (Reader r = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
            return parse(r, channel);
        }
    }

    static List<RawRecord> parseJson(String json, String channel) throws CollectorException {
        JsonNode root = JsonUtil.readTree(json);
        List<RawRecord> out = new ArrayList<>();
        if (root.isArray()) {
            addMessages(root, channel, out);
        } else if (root.has("messages")) {
            addMessages(root.get("messages"), channel, out);
        } else if (root.has("guild") && root.has("channels")) {
            for (JsonNode ch : root.get("channels")) {
                String name = JsonUtil.text(ch, "name");
                addMessages(ch.get("messages"), name == null ? channel : name, out);
            }
        }
        return out;
    }

    private static void addMessages(JsonNode messages, String channel, List<RawRecord> out) {
        if (messages == null || !messages.isArray()) return;
        for (JsonNode m : messages) {
            String content = JsonUtil.text(m, "content");
            if (content == null) continue;
            JsonNode author = m.get("author");
            String authorName = JsonUtil.text(author, "name");
            String date = JsonUtil.text(m, "timestamp");
            String messageId = JsonUtil.text(m, "id");
            String id = messageId != null
                    ? "discord_" + messageId
                    : "discord_" + digest(channel + '|' + JsonUtil.text(author, "id") + '|' + date + '|' + content);
            String url = JsonUtil.text(m, "url");

            Map<String, Long> counters = Map.of("reactions", sumCounts(m.get("reactions")));
            out.add(new RawRecord(id, null, content, authorName, date,
                    url != null ? url : "discord://" + channel, counters));
        }
    }

    private static long sumCounts(JsonNode reactions) {
        if (reactions == null || !reactions.isArray()) return 0L;
        long total = 0;
        for (JsonNode r : reactions) total += JsonUtil.number(r, "count");
        return total;
    }

    static List<RawRecord> parse(Reader csv, String channel) throws IOException {
        List<RawRecord> out = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(csv, FORMAT)) {
            for (CSVRecord row : parser) {
                String content = col(row, "Content");
                if (content == null) continue;
                String authorId = col(row, "AuthorID");
                String date = col(row, "Date");

                Map<String, Long> counters = Map.of("reactions", reactionCount(col(row, "Reactions")));
                String id = "discord_" + digest(channel + '|' + authorId + '|' + date + '|' + content);
                out.add(new RawRecord(id, null, content, col(row, "Author"), date,
                        "discord://" + channel, counters));
            }
        }
        return out;
    }

    /**
     * "👍 (3),🎉 (1)" sums to 4; entries without a count add one each. Newer
     * exporters write the column as a JSON array, whose {@code count}s are summed.
     */
    static long reactionCount(String reactions) {
        if (reactions == null || reactions.isBlank()) return 0L;
        if (reactions.trim().startsWith("[")) {
            try {
                return sumCounts(JsonUtil.readTree(reactions));
            } catch (CollectorException e) {
                log.debug("[Discord] reactions column is not JSON, counting entries: {}", e.getMessage());
            }
        }
        long total = 0;
        for (String part : reactions.split(",")) {
            if (part.isBlank()) continue;
            Matcher m = REACTION_COUNT.matcher(part);
            total += m.find() ? Long.parseLong(m.group(1)) : 1L;
        }
        return total;
    }

    private static String col(CSVRecord row, String name) {
        if (!row.isMapped(name) || !row.isSet(name)) return null;
        String v = row.get(name);
        return v == null || v.isBlank() ? null : v;
    }

    private static String digest(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8))).substring(0, 20);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }
}
