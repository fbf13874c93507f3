package io.clustersearch.scroll;

import com.fasterxml.jackson.databind.JsonNode;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.clustersearch.models.QueryDescriptor;
import io.clustersearch.models.ResultDocument;
import io.clustersearch.query.SearchBodyBuilder;
import io.clustersearch.transport.ClusterClient;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static io.clustersearch.config.Constants.PATH_SEARCH;

/**
 * Entry point for running searches: scroll iterators, lazy record streams and single-request
 * searches. Holds no per-search state.
 */
@Slf4j
public class ScrollSearcher {

    private final ClusterClient client;
    private final SearchBodyBuilder bodyBuilder;
    private final MetricsProvider metricsProvider;
    private final String keepAlive;

    public ScrollSearcher(ClusterClient client, MetricsProvider metricsProvider, String keepAlive) {
        this.client = client;
        this.bodyBuilder = new SearchBodyBuilder(client.getObjectMapper());
        this.metricsProvider = metricsProvider;
        this.keepAlive = keepAlive;
    }

    /**
     * Open a scroll cursor for the descriptor. The caller owns the returned iterator and must close it.
     */
    public ScrollIterator open(QueryDescriptor descriptor, int pageSize) {
        ScrollIterator iterator = new ScrollIterator(client, bodyBuilder, metricsProvider, keepAlive);
        iterator.open(descriptor, pageSize);
        return iterator;
    }

    /**
     * Open a scroll and wrap it as a lazy stream of formatted records.
     *
     * @param limit maximum number of records, 0 for all
     */
    public RecordStream stream(QueryDescriptor descriptor, int pageSize, RecordFormatter formatter, long limit) {
        return new RecordStream(open(descriptor, pageSize), formatter, metricsProvider, limit);
    }

    /**
     * Run a single search request without a cursor, returning at most {@code size} hits.
     */
    public List<ResultDocument> searchOnce(QueryDescriptor descriptor, int size) {
        String path = "/" + ScrollIterator.encodeIndex(descriptor.getIndexPattern()) + PATH_SEARCH;
        ClusterRequest request = ClusterRequest.post(path, bodyBuilder.build(descriptor, size));
        log.info("Searching '{}' over {} without scroll, size {}", descriptor.getIndexPattern(), descriptor.getRange(), size);
        ClusterResponse response = client.execute(request);
        JsonNode json = client.readTree(request, response);
        return HitParser.parse(json, client.getObjectMapper());
    }
}
