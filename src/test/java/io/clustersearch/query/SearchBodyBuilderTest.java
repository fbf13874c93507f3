package io.clustersearch.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.models.QueryDescriptor;
import io.clustersearch.models.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchBodyBuilderTest {

    private ObjectMapper objectMapper;
    private SearchBodyBuilder builder;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        builder = new SearchBodyBuilder(objectMapper);
    }

    @Test
    void testBuild_RangeAndQueryString() throws Exception {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .indexPattern("logs-*")
            .queryString("status:500 AND host:web-*")
            .timestampField("@timestamp")
            .range(TimeRange.ofEpochSeconds(1700000000L, 1700003600L))
            .build();

        JsonNode body = objectMapper.readTree(builder.build(descriptor, 500));

        assertThat(body.path("size").asInt()).isEqualTo(500);
        assertThat(body.path("sort").get(0).path("@timestamp").path("order").asText()).isEqualTo("asc");
        JsonNode must = body.path("query").path("bool").path("must");
        assertThat(must).hasSize(2);
        JsonNode range = must.get(0).path("range").path("@timestamp");
        assertThat(range.path("gte").asLong()).isEqualTo(1700000000000L);
        assertThat(range.path("lt").asLong()).isEqualTo(1700003600000L);
        assertThat(range.path("format").asText()).isEqualTo("epoch_millis");
        assertThat(must.get(1).path("query_string").path("query").asText()).isEqualTo("status:500 AND host:web-*");
        assertThat(body.has("_source")).isFalse();
    }

    @Test
    void testBuild_Projection() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .indexPattern("logs-*")
            .queryString("*")
            .timestampField("ts")
            .range(TimeRange.ofEpochSeconds(0, 60))
            .projectedField("host")
            .projectedField("ts")
            .build();

        JsonNode body = builder.buildTree(descriptor, 10);

        assertThat(body.path("_source")).hasSize(2);
        assertThat(body.path("_source").get(0).asText()).isEqualTo("host");
        assertThat(body.path("_source").get(1).asText()).isEqualTo("ts");
        assertThat(body.path("query").path("bool").path("must").get(0).path("range").has("ts")).isTrue();
    }
}
