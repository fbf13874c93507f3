package io.clustersearch.models;

import lombok.Value;

/**
 * Status and body returned by a cluster node.
 */
@Value
public class ClusterResponse {

    int status;
    String body;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
