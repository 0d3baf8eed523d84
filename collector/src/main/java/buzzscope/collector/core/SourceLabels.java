package buzzscope.collector.core;

/** Labels stored with cache entries to tell which fetch strategy produced them. */
public final class SourceLabels {
    public static final String HISTORICAL_ARCHIVE = "historical_archive";
    public static final String LIVE_SEARCH_ALL_TIME = "live_search_all_time";
    public static final String HOT_LISTING = "hot_listing";

    private SourceLabels() {}
}
