package io.clustersearch.scroll;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clustersearch.models.ResultDocument;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.clustersearch.config.Constants.FIELD_ES_ID;
import static io.clustersearch.config.Constants.FIELD_ES_INDEX;
import static io.clustersearch.config.Constants.FIELD_ES_SCORE;
import static io.clustersearch.config.Constants.FIELD_RAW;
import static io.clustersearch.config.Constants.FIELD_TIME;

/**
 * Turns a hit into the record the platform receives.
 *
 * The timestamp field becomes {@code _time} (epoch seconds when the value is an ISO-8601 date),
 * the other source fields are flattened, {@code es_*} hit metadata and the {@code _raw} hit JSON
 * are added on request.
 */
@Slf4j
public class RecordFormatter {

    private final String timestampField;
    private final boolean includeEs;
    private final boolean includeRaw;
    private final RecordFlattener flattener;
    private final ObjectMapper objectMapper;

    public RecordFormatter(String timestampField, boolean includeEs, boolean includeRaw,
                           RecordFlattener flattener, ObjectMapper objectMapper) {
        this.timestampField = timestampField;
        this.includeEs = includeEs;
        this.includeRaw = includeRaw;
        this.flattener = flattener;
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> format(ResultDocument document) {
        Map<String, Object> flat = flattener.flatten(document.getSource());
        Map<String, Object> record = new LinkedHashMap<>();

        Object timestamp = flat.remove(timestampField);
        if (timestamp != null) {
            record.put(FIELD_TIME, toEpochSeconds(timestamp));
        }
        record.putAll(flat);

        if (includeEs) {
            putIfPresent(record, FIELD_ES_INDEX, document.getIndex());
            putIfPresent(record, FIELD_ES_ID, document.getId());
            putIfPresent(record, FIELD_ES_SCORE, document.getScore());
        }
        if (includeRaw) {
            record.put(FIELD_RAW, rawJson(document));
        }
        return record;
    }

    private Object toEpochSeconds(Object timestamp) {
        if (!(timestamp instanceof String)) {
            return timestamp;
        }
        String value = (String) timestamp;
        try {
            Instant instant = OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            if (instant.getNano() == 0) {
                return instant.getEpochSecond();
            }
            return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
        } catch (DateTimeException e) {
            log.trace("Timestamp '{}' is not ISO-8601, passing it through", value);
            return value;
        }
    }

    private String rawJson(ResultDocument document) {
        ObjectNode hit = objectMapper.createObjectNode();
        hit.put("_index", document.getIndex());
        hit.put("_id", document.getId());
        hit.put("_score", document.getScore());
        hit.set("_source", objectMapper.valueToTree(document.getSource()));
        try {
            return objectMapper.writeValueAsString(hit);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize hit " + document.getId(), e);
        }
    }

    private static void putIfPresent(Map<String, Object> record, String key, Object value) {
        if (value != null) {
            record.put(key, value);
        }
    }
}
