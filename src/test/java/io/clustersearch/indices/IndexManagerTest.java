package io.clustersearch.indices;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.clustersearch.models.IndexDescriptor;
import io.clustersearch.transport.ClusterClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IndexManagerTest {

    @Mock
    private ClusterClient client;

    private IndexManager indexManager;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        indexManager = new IndexManager(client);
        when(client.getObjectMapper()).thenReturn(objectMapper);
        when(client.readTree(any(), any())).thenAnswer(invocation ->
            objectMapper.readTree(invocation.<ClusterResponse>getArgument(1).getBody()));
    }

    @Test
    void testListIndices_SortedByName() {
        // Given
        when(client.execute(any())).thenReturn(new ClusterResponse(200, "["
            + "{\"health\":\"yellow\",\"status\":\"open\",\"index\":\"metrics-2024\",\"uuid\":\"u2\","
            + "\"pri\":\"1\",\"rep\":\"1\",\"docs.count\":\"42\",\"docs.deleted\":\"0\",\"store.size\":\"2048\"},"
            + "{\"health\":\"green\",\"status\":\"open\",\"index\":\"logs-2024\",\"uuid\":\"u1\","
            + "\"pri\":\"3\",\"rep\":\"0\",\"docs.count\":\"1200\",\"store.size\":\"52341\"},"
            + "{\"status\":\"close\",\"index\":\"archive\",\"uuid\":\"u3\",\"pri\":\"1\",\"rep\":\"0\"}"
            + "]"));

        // When
        List<IndexDescriptor> indices = indexManager.listIndices();

        // Then
        assertThat(indices).extracting(IndexDescriptor::getName).containsExactly("archive", "logs-2024", "metrics-2024");
        IndexDescriptor logs = indices.get(1);
        assertThat(logs.getPrimaryShards()).isEqualTo(3);
        assertThat(logs.getDocsCount()).isEqualTo(1200L);
        assertThat(logs.getStoreSize()).isEqualTo(52341L);

        assertThat(indices.get(0).toRecord()).containsOnlyKeys("index", "status", "uuid", "primary_shards", "replica_shards");

        ArgumentCaptor<ClusterRequest> request = ArgumentCaptor.forClass(ClusterRequest.class);
        verify(client).execute(request.capture());
        assertThat(request.getValue().getPath()).startsWith("/_cat/indices?format=json");
    }

    @Test
    void testListIndices_Empty() {
        when(client.execute(any())).thenReturn(new ClusterResponse(200, "[]"));

        assertThat(indexManager.listIndices()).isEmpty();
    }

    @Test
    void testListIndices_NotAnArray() {
        when(client.execute(any())).thenReturn(new ClusterResponse(200, "{\"error\":\"nope\"}"));

        assertThatThrownBy(() -> indexManager.listIndices())
            .isInstanceOf(ClusterOperationFailedException.class)
            .hasMessageContaining("not a JSON array");
    }
}
