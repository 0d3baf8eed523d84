package buzzscope.collector.core;

import java.util.List;

/**
 * Fetch capability of one platform. Implementations never throw unchecked
 * exceptions for expected outcomes: an unsupported mode is
 * {@link CollectorError#NOT_SUPPORTED}, a bad key {@link CollectorError#AUTH_INVALID}.
 */
public interface PlatformCollector {
    Platform platform();

    /** Short display name, e.g. "Reddit (json)". */
    String name();

    List<RawRecord> fetch(String keyword, Mode mode, int limit) throws CollectorException;

    /** Label describing the strategy {@link #fetch} uses for the given mode. */
    default String sourceLabel(Mode mode) {
        return mode == Mode.HOT ? SourceLabels.HOT_LISTING : SourceLabels.LIVE_SEARCH_ALL_TIME;
    }
}
