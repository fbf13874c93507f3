package io.clustersearch.transport;

import io.clustersearch.models.ClusterEndpoint;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;

/**
 * Sends one request to one cluster node.
 * Implementations never throw for connection problems; they report them as
 * {@link NodeAttempt.Outcome#CONNECTION_FAILURE} so the node pool can fail over.
 */
public interface ClusterTransport {

    /**
     * @return SUCCESS with the node's response (any HTTP status the node answered with), or
     *         CONNECTION_FAILURE when the node could not serve the request
     */
    NodeAttempt<ClusterResponse> execute(ClusterEndpoint endpoint, ClusterRequest request);
}
