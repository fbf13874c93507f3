package io.clustersearch.transport;

import io.clustersearch.config.ClusterSettings;
import io.clustersearch.exceptions.AllNodesUnreachableException;
import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import io.clustersearch.exceptions.SearchCommandException;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ClusterEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.clustersearch.metrics.MetricsConstants.ENDPOINT_TAG;
import static io.clustersearch.metrics.MetricsConstants.NODE_FAILOVERS_METRIC_NAME;

/**
 * Ordered set of cluster endpoints with sticky failover.
 *
 * Operations start at the last endpoint that served a request and walk the declared order,
 * trying each endpoint at most once. Only connection-level failures move on to the next endpoint;
 * a request the cluster rejected fails immediately.
 */
@Slf4j
public class NodePool {

    private final List<ClusterEndpoint> endpoints;
    private final AtomicInteger preferredIndex;
    private final MetricsProvider metricsProvider;

    public NodePool(List<ClusterEndpoint> endpoints, MetricsProvider metricsProvider) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new InvalidQueryConfigurationException("At least one cluster endpoint is required (eaddr)");
        }
        this.endpoints = List.copyOf(endpoints);
        this.preferredIndex = new AtomicInteger(0);
        this.metricsProvider = metricsProvider;
        log.info("Node pool created with {} endpoint(s): {}", this.endpoints.size(), this.endpoints);
    }

    /**
     * Build a pool from cluster settings; scheme-less hosts follow the {@code use_ssl} flag.
     */
    public static NodePool fromSettings(ClusterSettings settings, MetricsProvider metricsProvider) {
        List<ClusterEndpoint> endpoints = settings.getHosts().stream()
            .map(host -> ClusterEndpoint.parse(host, settings.isUseSsl()))
            .collect(Collectors.toList());
        return new NodePool(endpoints, metricsProvider);
    }

    public List<ClusterEndpoint> getEndpoints() {
        return endpoints;
    }

    /**
     * @return the endpoint the next operation starts with
     */
    public ClusterEndpoint selectNode() {
        return endpoints.get(preferredIndex.get());
    }

    /**
     * Run an operation with failover across the endpoints.
     *
     * @param description short name of the operation, used in logs
     * @param operation attempt against a single endpoint
     * @return the value of the first successful attempt
     * @throws AllNodesUnreachableException after every endpoint failed to connect
     * @throws SearchCommandException the query failure reported by an endpoint, unchanged
     */
    public <T> T withFailover(String description, Function<ClusterEndpoint, NodeAttempt<T>> operation) {
        int size = endpoints.size();
        int start = preferredIndex.get();
        Throwable lastFailure = null;

        for (int attemptNumber = 0; attemptNumber < size; attemptNumber++) {
            int index = (start + attemptNumber) % size;
            ClusterEndpoint endpoint = endpoints.get(index);
            NodeAttempt<T> attempt = operation.apply(endpoint);

            switch (attempt.getOutcome()) {
                case SUCCESS:
                    if (index != start) {
                        preferredIndex.set(index);
                        log.info("{} succeeded on {} after {} failed attempt(s), preferring it from now on",
                                description, endpoint, attemptNumber);
                    }
                    return attempt.getValue();
                case QUERY_FAILURE:
                    log.debug("{} rejected by {}: {}", description, endpoint, attempt.getFailure().getMessage());
                    throw (SearchCommandException) attempt.getFailure();
                case CONNECTION_FAILURE:
                default:
                    lastFailure = attempt.getFailure();
                    metricsProvider.counter(NODE_FAILOVERS_METRIC_NAME, Map.of(ENDPOINT_TAG, endpoint.baseUrl())).increment();
                    log.warn("{} failed on {} ({}/{}): {}", description, endpoint, attemptNumber + 1, size,
                            lastFailure.getMessage());
                    break;
            }
        }

        log.error("{} failed: all {} endpoint(s) unreachable", description, size);
        throw new AllNodesUnreachableException(size, lastFailure);
    }
}
