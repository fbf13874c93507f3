package io.clustersearch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the cat indices API.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexDescriptor {

    @JsonProperty("index")
    String name;

    @JsonProperty("health")
    String health;

    @JsonProperty("status")
    String status;

    @JsonProperty("uuid")
    String uuid;

    @JsonProperty("pri")
    Integer primaryShards;

    @JsonProperty("rep")
    Integer replicaShards;

    @JsonProperty("docs.count")
    Long docsCount;

    @JsonProperty("store.size")
    Long storeSize;

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("index", name);
        record.put("health", health);
        record.put("status", status);
        record.put("uuid", uuid);
        record.put("primary_shards", primaryShards);
        record.put("replica_shards", replicaShards);
        record.put("docs_count", docsCount);
        record.put("store_size_bytes", storeSize);
        record.values().removeIf(value -> value == null);
        return record;
    }
}
