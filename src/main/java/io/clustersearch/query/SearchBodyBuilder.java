package io.clustersearch.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clustersearch.models.QueryDescriptor;

/**
 * Renders a {@link QueryDescriptor} as a search request body.
 *
 * The time range becomes a required {@code range} clause ({@code gte} start, {@code lt} end, in
 * epoch milliseconds) next to the pass-through {@code query_string}; hits are sorted by timestamp.
 */
public class SearchBodyBuilder {

    private final ObjectMapper objectMapper;

    public SearchBodyBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode buildTree(QueryDescriptor descriptor, int size) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("size", size);

        body.putArray("sort")
            .addObject()
            .putObject(descriptor.getTimestampField())
            .put("order", "asc");

        ArrayNode must = body.putObject("query")
            .putObject("bool")
            .putArray("must");
        must.addObject()
            .putObject("range")
            .putObject(descriptor.getTimestampField())
            .put("gte", descriptor.getRange().getStart().toEpochMilli())
            .put("lt", descriptor.getRange().getEnd().toEpochMilli())
            .put("format", "epoch_millis");
        must.addObject()
            .putObject("query_string")
            .put("query", descriptor.getQueryString());

        if (!descriptor.isFullDocument()) {
            ArrayNode source = body.putArray("_source");
            descriptor.getProjectedFields().forEach(source::add);
        }
        return body;
    }

    public String build(QueryDescriptor descriptor, int size) {
        try {
            return objectMapper.writeValueAsString(buildTree(descriptor, size));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search body", e);
        }
    }
}
