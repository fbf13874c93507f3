package io.clustersearch.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_TIMESTAMP_FIELD = "@timestamp";
    public static final int DEFAULT_PORT = 9200;
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int DEFAULT_SEARCH_SIZE = 10000;
    public static final String DEFAULT_SCROLL_TTL = "1m";
    public static final long DEFAULT_CONNECT_TIMEOUT_SECONDS = 10L;
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 60L;
    public static final String DEFAULT_EARLIEST = "now-1h";
    public static final String DEFAULT_LATEST = "now";
    public static final String DEFAULT_TIME_ZONE = "UTC";

    // Flattening
    public static final int MAX_FLATTEN_DEPTH = 32;

    // Command actions
    public static final String ACTION_INDICES_LIST = "indices-list";
    public static final String ACTION_CLUSTER_HEALTH = "cluster-health";

    // Cluster REST paths
    public static final String PATH_SEARCH = "/_search";
    public static final String PATH_SCROLL = "/_search/scroll";
    public static final String PATH_CAT_INDICES = "/_cat/indices?format=json&bytes=b&s=index";
    public static final String PATH_CLUSTER_HEALTH = "/_cluster/health";

    // Cluster error types
    public static final String ERROR_SEARCH_CONTEXT_MISSING = "search_context_missing_exception";

    // Record field names
    public static final String FIELD_TIME = "_time";
    public static final String FIELD_RAW = "_raw";
    public static final String FIELD_ES_INDEX = "es_index";
    public static final String FIELD_ES_ID = "es_id";
    public static final String FIELD_ES_SCORE = "es_score";
}
