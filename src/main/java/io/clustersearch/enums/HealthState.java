package io.clustersearch.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health state reported by the cluster health API.
 *
 * <ul>
 *   <li><strong>GREEN</strong> - all primary and replica shards are allocated</li>
 *   <li><strong>YELLOW</strong> - all primaries are allocated, some replicas are not</li>
 *   <li><strong>RED</strong> - at least one primary shard is unallocated</li>
 * </ul>
 */
public enum HealthState {
    GREEN,
    YELLOW,
    RED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HealthState fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (HealthState state : HealthState.values()) {
            if (state.name().equalsIgnoreCase(trimmed)) {
                return state;
            }
        }
        return null; // Unknown states are reported as absent rather than failing the whole response
    }
}
