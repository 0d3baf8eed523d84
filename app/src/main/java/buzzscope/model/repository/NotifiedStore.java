package buzzscope.model.repository;

import buzzscope.collector.core.Platform;
import buzzscope.model.domain.NotifiedKey;
import buzzscope.model.domain.NotifiedSet;
import buzzscope.util.AtomicFiles;
import buzzscope.util.Jsons;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists the monitor's {@link NotifiedSet}. A missing file is an empty set;
 * an unreadable one is an error, since treating it as empty would announce
 * every post again.
 */
public class NotifiedStore {
    private final Path file;
    private final ObjectMapper om = Jsons.mapper();

    public NotifiedStore(Path file) { this.file = file; }

    public Path file() { return file; }

    public synchronized NotifiedSet load() throws IOException {
        if (!Files.exists(file)) return NotifiedSet.EMPTY;
        Document doc;
        try {
            doc = om.readValue(Files.readAllBytes(file), Document.class);
        } catch (RuntimeException e) {
            throw new IOException("corrupt notified set " + file + ": " + e.getMessage(), e);
        }
        Map<NotifiedKey, Instant> m = new LinkedHashMap<>();
        for (Item it : doc.entries() == null ? List.<Item>of() : doc.entries()) {
            if (it == null || it.platform() == null || it.id() == null || it.notifiedAt() == null) {
                throw new IOException("incomplete entry in " + file);
            }
            m.put(new NotifiedKey(it.platform(), it.id()), it.notifiedAt());
        }
        return new NotifiedSet(m);
    }

    public synchronized void save(NotifiedSet set) throws IOException {
        List<Item> items = new ArrayList<>(set.size());
        set.entries().forEach((k, at) -> items.add(new Item(k.platform(), k.id(), at)));
        AtomicFiles.write(file, om.writeValueAsBytes(new Document(1, items)));
    }

    record Document(int formatVersion, List<Item> entries) {}

    record Item(Platform platform, String id, Instant notifiedAt) {}
}
