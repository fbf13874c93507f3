package io.clustersearch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clustersearch.enums.HealthState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of the cluster health API, reduced to the cluster-level counters.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterHealthSummary {

    @JsonProperty("cluster_name")
    String clusterName;

    @JsonProperty("status")
    HealthState status;

    @JsonProperty("timed_out")
    boolean timedOut;

    @JsonProperty("number_of_nodes")
    int numberOfNodes;

    @JsonProperty("number_of_data_nodes")
    int numberOfDataNodes;

    @JsonProperty("active_primary_shards")
    int activePrimaryShards;

    @JsonProperty("active_shards")
    int activeShards;

    @JsonProperty("relocating_shards")
    int relocatingShards;

    @JsonProperty("initializing_shards")
    int initializingShards;

    @JsonProperty("unassigned_shards")
    int unassignedShards;

    @JsonProperty("active_shards_percent_as_number")
    double activeShardsPercent;

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("cluster_name", clusterName);
        record.put("status", status != null ? status.getValue() : "unknown");
        record.put("timed_out", timedOut);
        record.put("number_of_nodes", numberOfNodes);
        record.put("number_of_data_nodes", numberOfDataNodes);
        record.put("active_primary_shards", activePrimaryShards);
        record.put("active_shards", activeShards);
        record.put("relocating_shards", relocatingShards);
        record.put("initializing_shards", initializingShards);
        record.put("unassigned_shards", unassignedShards);
        record.put("active_shards_percent", activeShardsPercent);
        return record;
    }
}
