package io.clustersearch.models;

import lombok.Value;

import java.util.Map;

/**
 * One search hit: source fields plus the hit metadata.
 */
@Value
public class ResultDocument {

    String index;
    String id;
    Double score;
    Map<String, Object> source;
}
