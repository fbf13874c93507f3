package io.clustersearch.models;

import lombok.ToString;
import lombok.Value;
import lombok.With;

/**
 * Cluster-issued scroll handle with the page size and keep-alive it was opened with.
 */
@Value
public class ScrollCursor {

    @With
    @ToString.Exclude
    String scrollId;

    int pageSize;

    /** Keep-alive in cluster time units, e.g. {@code 1m}. */
    String keepAlive;
}
