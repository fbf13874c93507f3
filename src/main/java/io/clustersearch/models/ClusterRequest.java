package io.clustersearch.models;

import lombok.Value;

/**
 * HTTP request against one cluster node, relative to the node's base URL.
 */
@Value
public class ClusterRequest {

    String method;

    /** Path with query string, e.g. {@code /logs/_search?scroll=1m}. */
    String path;

    /** JSON body, null when the request has none. */
    String body;

    public static ClusterRequest get(String path) {
        return new ClusterRequest("GET", path, null);
    }

    public static ClusterRequest post(String path, String body) {
        return new ClusterRequest("POST", path, body);
    }

    public static ClusterRequest delete(String path, String body) {
        return new ClusterRequest("DELETE", path, body);
    }
}
