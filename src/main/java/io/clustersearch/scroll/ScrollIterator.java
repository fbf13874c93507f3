package io.clustersearch.scroll;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.exceptions.CursorExpiredException;
import io.clustersearch.exceptions.SearchCommandException;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.clustersearch.models.QueryDescriptor;
import io.clustersearch.models.ResultDocument;
import io.clustersearch.models.ScrollCursor;
import io.clustersearch.query.SearchBodyBuilder;
import io.clustersearch.transport.ClusterClient;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static io.clustersearch.config.Constants.ERROR_SEARCH_CONTEXT_MISSING;
import static io.clustersearch.config.Constants.PATH_SCROLL;
import static io.clustersearch.config.Constants.PATH_SEARCH;
import static io.clustersearch.metrics.MetricsConstants.SCROLL_PAGES_METRIC_NAME;

/**
 * Forward-only pager over one scroll cursor.
 *
 * {@link #open} sends the initial search and keeps its hits as the first page; every later
 * {@link #next} call sends one scroll request. Only the page being returned is referenced, so
 * memory stays bounded by the page size. Not thread safe: one iterator serves one search.
 */
@Slf4j
public class ScrollIterator implements AutoCloseable {

    private static final String NO_SEARCH_CONTEXT = "No search context found";
    private static final String INVALID_RESPONSE = "invalid_response";

    private final ClusterClient client;
    private final SearchBodyBuilder bodyBuilder;
    private final MetricsProvider metricsProvider;
    private final String keepAlive;

    private ScrollState state = ScrollState.UNOPENED;
    private ScrollCursor cursor;
    private List<ResultDocument> pendingPage;
    private long pagesFetched;
    private long documentsFetched;

    ScrollIterator(ClusterClient client, SearchBodyBuilder bodyBuilder, MetricsProvider metricsProvider, String keepAlive) {
        this.client = client;
        this.bodyBuilder = bodyBuilder;
        this.metricsProvider = metricsProvider;
        this.keepAlive = keepAlive;
    }

    /**
     * Send the initial search and open the cursor.
     *
     * @throws IllegalStateException if this iterator was already opened
     */
    void open(QueryDescriptor descriptor, int pageSize) {
        if (state != ScrollState.UNOPENED) {
            throw new IllegalStateException("Scroll already opened, state " + state);
        }
        String path = "/" + encodeIndex(descriptor.getIndexPattern()) + PATH_SEARCH + "?scroll=" + keepAlive;
        ClusterRequest request = ClusterRequest.post(path, bodyBuilder.build(descriptor, pageSize));
        log.info("Opening scroll on '{}' over {} with page size {} and keep-alive {}",
            descriptor.getIndexPattern(), descriptor.getRange(), pageSize, keepAlive);

        ClusterResponse response = client.execute(request);
        JsonNode json = client.readTree(request, response);
        String scrollId = json.path("_scroll_id").asText(null);
        cursor = new ScrollCursor(scrollId, pageSize, keepAlive);
        state = ScrollState.OPEN;

        try {
            pendingPage = parseHits(json);
            if (scrollId == null && !pendingPage.isEmpty()) {
                throw new ClusterOperationFailedException(response.getStatus(), INVALID_RESPONSE,
                    "Search response for '" + descriptor.getIndexPattern() + "' has hits but no scroll id");
            }
            log.info("Scroll opened, total hits: {}", json.path("hits").path("total").path("value").asText("unknown"));
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    /**
     * Fetch the next page. The first call returns the hits of the initial search without a
     * network call; an empty page marks the end of the results.
     *
     * @throws CursorExpiredException if the cluster no longer knows the cursor
     * @throws IllegalStateException if the iterator was never opened or is closed
     */
    public ScrollPage next() {
        switch (state) {
            case EXHAUSTED:
                return ScrollPage.done();
            case UNOPENED:
            case CLOSED:
                throw new IllegalStateException("Scroll is not open, state " + state);
            case OPEN:
            default:
                break;
        }

        List<ResultDocument> page;
        if (pendingPage != null) {
            page = pendingPage;
            pendingPage = null;
        } else {
            page = fetchNextPage();
        }

        pagesFetched++;
        documentsFetched += page.size();
        metricsProvider.counter(SCROLL_PAGES_METRIC_NAME, Map.of()).increment();

        if (page.isEmpty()) {
            log.info("Scroll exhausted after {} page(s), {} document(s)", pagesFetched, documentsFetched);
            state = ScrollState.EXHAUSTED;
            return ScrollPage.done();
        }
        log.debug("Scroll page {} with {} document(s)", pagesFetched, page.size());
        return ScrollPage.of(page);
    }

    /**
     * Release the cursor on the cluster. Best effort: a failed release is logged, the cluster
     * expires the cursor on its own. Calling close more than once has no effect.
     */
    @Override
    public void close() {
        if (state == ScrollState.CLOSED) {
            return;
        }
        ScrollState previous = state;
        state = ScrollState.CLOSED;
        pendingPage = null;

        if (previous == ScrollState.UNOPENED || cursor == null || cursor.getScrollId() == null) {
            return;
        }
        ObjectNode body = client.getObjectMapper().createObjectNode();
        body.putArray("scroll_id").add(cursor.getScrollId());
        try {
            client.execute(ClusterRequest.delete(PATH_SCROLL, body.toString()));
            log.info("Scroll cursor released after {} page(s), {} document(s)", pagesFetched, documentsFetched);
        } catch (SearchCommandException e) {
            log.warn("Failed to release scroll cursor, cluster will expire it after {}: {}", keepAlive, e.getMessage());
        }
    }

    public ScrollState getState() {
        return state;
    }

    public ScrollCursor getCursor() {
        return cursor;
    }

    private List<ResultDocument> fetchNextPage() {
        ObjectNode body = client.getObjectMapper().createObjectNode();
        body.put("scroll", keepAlive);
        body.put("scroll_id", cursor.getScrollId());
        ClusterRequest request = ClusterRequest.post(PATH_SCROLL, body.toString());

        ClusterResponse response;
        try {
            response = client.execute(request);
        } catch (ClusterOperationFailedException e) {
            if (isCursorMissing(e)) {
                state = ScrollState.CLOSED;
                pendingPage = null;
                log.error("Scroll cursor expired after {} page(s), {} document(s): {}",
                    pagesFetched, documentsFetched, e.getMessage());
                throw new CursorExpiredException(String.format(
                    "Scroll cursor expired after %d document(s); results may be incomplete (%s)",
                    documentsFetched, e.getMessage()));
            }
            throw e;
        }

        JsonNode json = client.readTree(request, response);
        String refreshed = json.path("_scroll_id").asText(null);
        if (refreshed != null) {
            cursor = cursor.withScrollId(refreshed);
        }
        return parseHits(json);
    }

    private List<ResultDocument> parseHits(JsonNode json) {
        return HitParser.parse(json, client.getObjectMapper());
    }

    private static boolean isCursorMissing(ClusterOperationFailedException e) {
        return e.getStatus() == 404
            || ERROR_SEARCH_CONTEXT_MISSING.equals(e.getErrorType())
            || (e.getMessage() != null && e.getMessage().contains(NO_SEARCH_CONTEXT));
    }

    static String encodeIndex(String indexPattern) {
        return URLEncoder.encode(indexPattern, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%2C", ",")
            .replace("%2A", "*");
    }
}
