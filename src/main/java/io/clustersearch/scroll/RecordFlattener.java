package io.clustersearch.scroll;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a document tree into a single-level record.
 *
 * Object members join with {@code .} and array elements with {@code [i]}, e.g.
 * {@code {"a":{"b":[1,2]}}} becomes {@code a.b[0]=1, a.b[1]=2}. When two paths produce the same key
 * the later one wins. Subtrees deeper than the maximum depth are written as a JSON string; null
 * leaves are dropped.
 */
@Slf4j
public class RecordFlattener {

    private final ObjectMapper objectMapper;
    private final int maxDepth;

    public RecordFlattener(ObjectMapper objectMapper, int maxDepth) {
        this.objectMapper = objectMapper;
        this.maxDepth = maxDepth;
    }

    public Map<String, Object> flatten(Map<String, Object> source) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            flattenValue(entry.getKey(), entry.getValue(), 1, flat);
        }
        return flat;
    }

    private void flattenValue(String key, Object value, int depth, Map<String, Object> flat) {
        if (value == null) {
            return;
        }
        if (value instanceof Map || value instanceof List) {
            if (depth >= maxDepth) {
                flat.put(key, toJson(value));
                return;
            }
            if (value instanceof Map) {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    flattenValue(key + "." + entry.getKey(), entry.getValue(), depth + 1, flat);
                }
            } else {
                List<?> list = (List<?>) value;
                for (int i = 0; i < list.size(); i++) {
                    flattenValue(key + "[" + i + "]", list.get(i), depth + 1, flat);
                }
            }
            return;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            flat.put(key, value);
        } else {
            flat.put(key, String.valueOf(value));
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize nested value as JSON, using toString: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
