package io.clustersearch.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.models.ClusterHealthSummary;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.clustersearch.transport.ClusterClient;
import lombok.extern.slf4j.Slf4j;

import static io.clustersearch.config.Constants.PATH_CLUSTER_HEALTH;

/**
 * Reads the cluster-level health summary.
 */
@Slf4j
public class ClusterHealthManager {

    private final ClusterClient client;

    public ClusterHealthManager(ClusterClient client) {
        this.client = client;
    }

    /**
     * @throws ClusterOperationFailedException if the cluster rejects the request or answers with
     *         something that is not a health document
     */
    public ClusterHealthSummary getClusterHealth() {
        log.info("Fetching cluster health");
        ClusterRequest request = ClusterRequest.get(PATH_CLUSTER_HEALTH);
        ClusterResponse response = client.execute(request);
        JsonNode json = client.readTree(request, response);
        if (!json.isObject()) {
            throw new ClusterOperationFailedException(response.getStatus(), "invalid_response",
                "Cluster health response is not a JSON object");
        }

        try {
            ClusterHealthSummary health = client.getObjectMapper().treeToValue(json, ClusterHealthSummary.class);
            log.info("Cluster '{}' health is {} with {} node(s)", health.getClusterName(), health.getStatus(),
                health.getNumberOfNodes());
            return health;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ClusterOperationFailedException(response.getStatus(), "invalid_response",
                "Failed to read cluster health response: " + e.getMessage());
        }
    }
}
