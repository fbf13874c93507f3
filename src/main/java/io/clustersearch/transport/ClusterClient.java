package io.clustersearch.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Executes cluster requests through the node pool and turns error responses into
 * {@link ClusterOperationFailedException}.
 */
@Slf4j
public class ClusterClient {

    private final NodePool nodePool;
    private final ClusterTransport transport;
    private final ObjectMapper objectMapper;

    public ClusterClient(NodePool nodePool, ClusterTransport transport, ObjectMapper objectMapper) {
        this.nodePool = nodePool;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    /**
     * Send a request to the first reachable node.
     *
     * @return the 2xx response
     * @throws ClusterOperationFailedException if the cluster answered with an error status
     * @throws io.clustersearch.exceptions.AllNodesUnreachableException if no node could be reached
     */
    public ClusterResponse execute(ClusterRequest request) {
        String description = request.getMethod() + " " + pathWithoutQuery(request.getPath());
        return nodePool.withFailover(description, endpoint -> checkStatus(request, transport.execute(endpoint, request)));
    }

    /**
     * Parse a response body as JSON.
     *
     * @throws ClusterOperationFailedException if the body is not JSON
     */
    public JsonNode readTree(ClusterRequest request, ClusterResponse response) {
        try {
            return objectMapper.readTree(response.getBody() != null ? response.getBody() : "");
        } catch (IOException e) {
            throw new ClusterOperationFailedException(response.getStatus(), "invalid_response",
                String.format("%s %s returned a body that is not JSON: %s",
                    request.getMethod(), pathWithoutQuery(request.getPath()), e.getMessage()));
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public NodePool getNodePool() {
        return nodePool;
    }

    private NodeAttempt<ClusterResponse> checkStatus(ClusterRequest request, NodeAttempt<ClusterResponse> attempt) {
        return attempt.<ClusterResponse>then(response -> response.isSuccess()
            ? NodeAttempt.success(response)
            : NodeAttempt.queryFailure(toFailure(request, response)));
    }

    private ClusterOperationFailedException toFailure(ClusterRequest request, ClusterResponse response) {
        String type = "http_" + response.getStatus();
        String reason = response.getBody();
        try {
            JsonNode error = objectMapper.readTree(response.getBody() != null ? response.getBody() : "").path("error");
            if (error.isObject()) {
                JsonNode rootCause = error.path("root_cause").path(0);
                type = error.path("type").asText(type);
                reason = error.path("reason").asText(rootCause.path("reason").asText(reason));
            } else if (error.isTextual()) {
                reason = error.asText();
            }
        } catch (IOException e) {
            log.debug("Error body of {} {} is not JSON: {}", request.getMethod(), request.getPath(), e.getMessage());
        }
        String message = String.format("Cluster rejected %s %s with HTTP %d [%s]: %s",
            request.getMethod(), pathWithoutQuery(request.getPath()), response.getStatus(), type, reason);
        return new ClusterOperationFailedException(response.getStatus(), type, message);
    }

    private static String pathWithoutQuery(String path) {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }
}
