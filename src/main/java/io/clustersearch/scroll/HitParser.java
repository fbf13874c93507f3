package io.clustersearch.scroll;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.models.ResultDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code hits.hits} of a search or scroll response.
 */
final class HitParser {

    private static final TypeReference<LinkedHashMap<String, Object>> SOURCE_TYPE = new TypeReference<>() {};

    private HitParser() {
    }

    static List<ResultDocument> parse(JsonNode response, ObjectMapper objectMapper) {
        JsonNode hits = response.path("hits").path("hits");
        if (!hits.isArray() || hits.isEmpty()) {
            return Collections.emptyList();
        }
        List<ResultDocument> documents = new ArrayList<>(hits.size());
        for (JsonNode hit : hits) {
            JsonNode source = hit.path("_source");
            Map<String, Object> fields = source.isObject()
                ? objectMapper.convertValue(source, SOURCE_TYPE)
                : Collections.emptyMap();
            JsonNode score = hit.path("_score");
            documents.add(new ResultDocument(
                hit.path("_index").asText(null),
                hit.path("_id").asText(null),
                score.isNumber() ? score.asDouble() : null,
                fields));
        }
        return documents;
    }
}
