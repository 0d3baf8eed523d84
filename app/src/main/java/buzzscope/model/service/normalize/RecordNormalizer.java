package buzzscope.model.service.normalize;

import buzzscope.collector.core.Platform;
import buzzscope.collector.core.RawRecord;
import buzzscope.collector.util.TimeUtil;
import buzzscope.model.domain.Post;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/** RawRecord to Post. Records without a usable id or timestamp are dropped, never patched. */
public class RecordNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

    public Post normalize(RawRecord r, Platform platform) throws NormalizationException {
        if (r == null) throw new NormalizationException("null record");
        String id = blankToNull(r.id());
        if (id == null) throw new NormalizationException("record without id");

        Instant ts = TimeUtil.parseInstant(r.createdAt())
                .orElseThrow(() -> new NormalizationException(
                        "record " + id + " has no usable timestamp: '" + r.createdAt() + "'"));

        long interactions;
        try {
            interactions = InteractionWeights.interactionCount(platform, r);
        } catch (ArithmeticException e) {
            interactions = Long.MAX_VALUE;
        }

        return new Post(platform, id,
                blankToNull(r.title()),
                blankToNull(r.body()),
                blankToNull(r.author()),
                ts, interactions,
                blankToNull(r.url()));
    }

    /** Keeps collector order; the first record of a duplicated id wins. */
    public List<Post> normalizeAll(List<RawRecord> records, Platform platform) {
        List<Post> out = new ArrayList<>(records.size());
        Set<String> seen = new HashSet<>();
        int dropped = 0;
        for (RawRecord r : records) {
            try {
                Post p = normalize(r, platform);
                if (seen.add(p.id())) {
                    out.add(p);
                } else {
                    log.debug("[Normalize] {} duplicate id {} dropped", platform.id(), p.id());
                }
            } catch (NormalizationException e) {
                dropped++;
                log.warn("[Normalize] {} record dropped: {}", platform.id(), e.getMessage());
            }
        }
        if (dropped > 0) log.info("[Normalize] {}: kept {}, dropped {}", platform.id(), out.size(), dropped);
        return out;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
