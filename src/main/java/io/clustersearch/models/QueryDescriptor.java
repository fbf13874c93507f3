package io.clustersearch.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to issue one search against the cluster.
 */
@Value
@Builder
public class QueryDescriptor {

    String indexPattern;

    /** Cluster-native query_string syntax, passed through untouched. */
    String queryString;

    String timestampField;

    TimeRange range;

    /** Requested source fields in order; empty means full documents. */
    @Singular
    List<String> projectedFields;

    public boolean isFullDocument() {
        return projectedFields.isEmpty();
    }
}
