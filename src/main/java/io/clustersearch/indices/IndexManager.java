package io.clustersearch.indices;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.clustersearch.models.IndexDescriptor;
import io.clustersearch.transport.ClusterClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static io.clustersearch.config.Constants.PATH_CAT_INDICES;

/**
 * Lists the indices of the cluster.
 */
@Slf4j
public class IndexManager {

    private static final TypeReference<List<IndexDescriptor>> INDEX_LIST_TYPE = new TypeReference<>() {};

    private final ClusterClient client;

    public IndexManager(ClusterClient client) {
        this.client = client;
    }

    /**
     * @return one descriptor per index, ordered by index name
     * @throws ClusterOperationFailedException if the cluster rejects the request or the answer is
     *         not an index listing
     */
    public List<IndexDescriptor> listIndices() {
        log.info("Listing indices");
        ClusterRequest request = ClusterRequest.get(PATH_CAT_INDICES);
        ClusterResponse response = client.execute(request);
        JsonNode json = client.readTree(request, response);
        if (!json.isArray()) {
            throw new ClusterOperationFailedException(response.getStatus(), "invalid_response",
                "Index listing response is not a JSON array");
        }

        List<IndexDescriptor> indices;
        try {
            indices = new ArrayList<>(client.getObjectMapper().convertValue(json, INDEX_LIST_TYPE));
        } catch (IllegalArgumentException e) {
            throw new ClusterOperationFailedException(response.getStatus(), "invalid_response",
                "Failed to read index listing: " + e.getMessage());
        }
        indices.sort(Comparator.comparing(IndexDescriptor::getName, Comparator.nullsLast(Comparator.naturalOrder())));
        log.info("Cluster reported {} index(es)", indices.size());
        return indices;
    }
}
