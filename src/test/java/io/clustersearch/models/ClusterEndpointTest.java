package io.clustersearch.models;

import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterEndpointTest {

    @Test
    void testParse_HostAndPort() {
        ClusterEndpoint endpoint = ClusterEndpoint.parse("10.0.0.1:9201", false);

        assertThat(endpoint.getHost()).isEqualTo("10.0.0.1");
        assertThat(endpoint.getPort()).isEqualTo(9201);
        assertThat(endpoint.isSecure()).isFalse();
        assertThat(endpoint.baseUrl()).isEqualTo("http://10.0.0.1:9201");
    }

    @Test
    void testParse_DefaultPort() {
        assertThat(ClusterEndpoint.parse("nodeA", false).getPort()).isEqualTo(9200);
    }

    @Test
    void testParse_SchemeWins() {
        assertThat(ClusterEndpoint.parse("https://nodeA:9243", false).isSecure()).isTrue();
        assertThat(ClusterEndpoint.parse("http://nodeA:9200", true).isSecure()).isFalse();
    }

    @Test
    void testParse_UseSslAppliesWithoutScheme() {
        ClusterEndpoint endpoint = ClusterEndpoint.parse(" nodeA:9200 ", true);

        assertThat(endpoint.isSecure()).isTrue();
        assertThat(endpoint.toString()).isEqualTo("https://nodeA:9200");
    }

    @Test
    void testParse_HostWithUnderscore() {
        ClusterEndpoint endpoint = ClusterEndpoint.parse("es_node:9200", false);

        assertThat(endpoint.getHost()).isEqualTo("es_node");
        assertThat(endpoint.getPort()).isEqualTo(9200);
        assertThat(endpoint.baseUrl()).isEqualTo("http://es_node:9200");
        assertThat(ClusterEndpoint.parse("https://search_1", false).baseUrl()).isEqualTo("https://search_1:9200");
        assertThatThrownBy(() -> ClusterEndpoint.parse("es_node:port", false))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("bad port");
    }

    @Test
    void testParse_Invalid() {
        assertThatThrownBy(() -> ClusterEndpoint.parse("", false))
            .isInstanceOf(InvalidQueryConfigurationException.class);
        assertThatThrownBy(() -> ClusterEndpoint.parse("ftp://nodeA:21", false))
            .isInstanceOf(InvalidQueryConfigurationException.class)
            .hasMessageContaining("unsupported scheme");
        assertThatThrownBy(() -> ClusterEndpoint.parse("http://:9200", false))
            .isInstanceOf(InvalidQueryConfigurationException.class);
    }
}
