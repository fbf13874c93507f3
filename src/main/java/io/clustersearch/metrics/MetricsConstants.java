package io.clustersearch.metrics;

/**
 * Constants for metrics names and tags used by the search command.
 */
public class MetricsConstants {
    public final static String CLUSTER_REQUESTS_METRIC_NAME = "cluster_requests";
    public final static String NODE_FAILOVERS_METRIC_NAME = "node_failovers";
    public final static String SCROLL_PAGES_METRIC_NAME = "scroll_pages";
    public final static String RECORDS_EMITTED_METRIC_NAME = "records_emitted";
    public final static String ENDPOINT_TAG = "endpoint";
    public final static String OUTCOME_TAG = "outcome";
    public final static String ACTION_TAG = "action";

    private MetricsConstants() {}
}
