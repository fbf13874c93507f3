package io.clustersearch.scroll;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.models.ResultDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordFormatterTest {

    private ObjectMapper objectMapper;
    private RecordFlattener flattener;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        flattener = new RecordFlattener(objectMapper, 32);
    }

    private static ResultDocument document(Object timestamp) {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("message", "disk full");
        source.put("@timestamp", timestamp);
        source.put("host", Map.of("name", "web-1"));
        return new ResultDocument("logs-2024.01.01", "abc", 1.25, source);
    }

    @Test
    void testFormat_TimestampBecomesTimeFirst() {
        RecordFormatter formatter = new RecordFormatter("@timestamp", false, false, flattener, objectMapper);

        Map<String, Object> record = formatter.format(document("2024-01-01T00:00:30Z"));

        assertThat(record.keySet()).containsExactly("_time", "message", "host.name");
        assertThat(record.get("_time")).isEqualTo(1704067230L);
    }

    @Test
    void testFormat_FractionalAndOffsetTimestamps() {
        RecordFormatter formatter = new RecordFormatter("@timestamp", false, false, flattener, objectMapper);

        assertThat(formatter.format(document("2024-01-01T01:00:00.250+01:00")).get("_time")).isEqualTo(1704067200.25);
    }

    @Test
    void testFormat_NonIsoTimestampPassesThrough() {
        RecordFormatter formatter = new RecordFormatter("@timestamp", false, false, flattener, objectMapper);

        assertThat(formatter.format(document(1704067200000L)).get("_time")).isEqualTo(1704067200000L);
        assertThat(formatter.format(document("yesterday")).get("_time")).isEqualTo("yesterday");
    }

    @Test
    void testFormat_MissingTimestamp() {
        RecordFormatter formatter = new RecordFormatter("event_time", false, false, flattener, objectMapper);

        Map<String, Object> record = formatter.format(document("2024-01-01T00:00:30Z"));

        assertThat(record).doesNotContainKey("_time");
        assertThat(record).containsEntry("@timestamp", "2024-01-01T00:00:30Z");
    }

    @Test
    void testFormat_MetadataAndRaw() throws Exception {
        RecordFormatter formatter = new RecordFormatter("@timestamp", true, true, flattener, objectMapper);

        Map<String, Object> record = formatter.format(document("2024-01-01T00:00:30Z"));

        assertThat(record).containsEntry("es_index", "logs-2024.01.01")
            .containsEntry("es_id", "abc")
            .containsEntry("es_score", 1.25);
        JsonNode raw = objectMapper.readTree((String) record.get("_raw"));
        assertThat(raw.path("_id").asText()).isEqualTo("abc");
        assertThat(raw.path("_source").path("host").path("name").asText()).isEqualTo("web-1");
        assertThat(raw.path("_source").path("@timestamp").asText()).isEqualTo("2024-01-01T00:00:30Z");
    }

    @Test
    void testFormat_NullScoreOmitted() {
        RecordFormatter formatter = new RecordFormatter("@timestamp", true, false, flattener, objectMapper);
        ResultDocument unscored = new ResultDocument("logs", "1", null, Map.of("a", 1));

        assertThat(formatter.format(unscored)).containsOnlyKeys("a", "es_index", "es_id");
    }
}
