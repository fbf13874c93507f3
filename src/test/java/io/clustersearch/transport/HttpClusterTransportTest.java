package io.clustersearch.transport;

import com.sun.net.httpserver.HttpServer;
import io.clustersearch.config.ClusterSettings;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.exceptions.TransportTimeoutException;
import io.clustersearch.metrics.MetricsConstants;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ClusterEndpoint;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpClusterTransportTest {

    private HttpServer server;
    private ExecutorService executor;
    private ClusterEndpoint endpoint;
    private SimpleMeterRegistry registry;
    private MetricsProvider metricsProvider;
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/_cluster/health", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            reply(exchange, 200, "{\"status\":\"green\"}");
        });
        server.createContext("/missing/_search", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            reply(exchange, 404, "{\"error\":{\"type\":\"index_not_found_exception\"},\"status\":404}");
        });
        server.createContext("/overloaded", exchange -> reply(exchange, 503, "{}"));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply(exchange, 200, "{}");
        });
        server.start();

        endpoint = ClusterEndpoint.parse("127.0.0.1:" + server.getAddress().getPort(), false);
        registry = new SimpleMeterRegistry();
        metricsProvider = new MetricsProvider(registry, "test-host");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    void testExecute_Success() {
        HttpClusterTransport transport = transport(ClusterSettings.builder().build());

        NodeAttempt<ClusterResponse> attempt = transport.execute(endpoint, ClusterRequest.get("/_cluster/health"));

        assertThat(attempt.getOutcome()).isEqualTo(NodeAttempt.Outcome.SUCCESS);
        assertThat(attempt.getValue().getStatus()).isEqualTo(200);
        assertThat(attempt.getValue().getBody()).contains("green");
        assertThat(lastAuthorization.get()).isNull();
        assertThat(registry.find(MetricsConstants.CLUSTER_REQUESTS_METRIC_NAME)
            .tag(MetricsConstants.OUTCOME_TAG, "success").timer()).isNotNull();
    }

    @Test
    void testExecute_ErrorStatusIsReturnedAsResponse() {
        HttpClusterTransport transport = transport(ClusterSettings.builder().build());

        NodeAttempt<ClusterResponse> attempt =
            transport.execute(endpoint, ClusterRequest.post("/missing/_search", "{\"size\":1}"));

        assertThat(attempt.getOutcome()).isEqualTo(NodeAttempt.Outcome.SUCCESS);
        assertThat(attempt.getValue().getStatus()).isEqualTo(404);
        assertThat(attempt.getValue().isSuccess()).isFalse();
        assertThat(lastBody.get()).isEqualTo("{\"size\":1}");
    }

    @Test
    void testExecute_ServiceUnavailableIsConnectionFailure() {
        HttpClusterTransport transport = transport(ClusterSettings.builder().build());

        NodeAttempt<ClusterResponse> attempt = transport.execute(endpoint, ClusterRequest.get("/overloaded"));

        assertThat(attempt.getOutcome()).isEqualTo(NodeAttempt.Outcome.CONNECTION_FAILURE);
        assertThat(attempt.getFailure()).isInstanceOf(ClusterOperationFailedException.class);
        assertThat(((ClusterOperationFailedException) attempt.getFailure()).getStatus()).isEqualTo(503);
    }

    @Test
    void testExecute_ClosedPortIsConnectionFailure() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpClusterTransport transport = transport(ClusterSettings.builder().build());

        NodeAttempt<ClusterResponse> attempt = transport.execute(
            ClusterEndpoint.parse("127.0.0.1:" + closedPort, false), ClusterRequest.get("/_cluster/health"));

        assertThat(attempt.getOutcome()).isEqualTo(NodeAttempt.Outcome.CONNECTION_FAILURE);
        assertThat(attempt.getFailure()).isInstanceOf(IOException.class);
    }

    @Test
    void testExecute_SendsBasicAuthorization() {
        HttpClusterTransport transport = transport(ClusterSettings.builder().user("reader").password("secret").build());

        transport.execute(endpoint, ClusterRequest.get("/_cluster/health"));

        String expected = "Basic " + Base64.getEncoder().encodeToString("reader:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(lastAuthorization.get()).isEqualTo(expected);
    }

    @Test
    void testExecute_RequestTimeoutIsConnectionFailure() {
        HttpClusterTransport transport = new HttpClusterTransport(ClusterSettings.builder().build(),
            Duration.ofSeconds(2), Duration.ofMillis(200), metricsProvider);

        NodeAttempt<ClusterResponse> attempt = transport.execute(endpoint, ClusterRequest.get("/slow"));

        assertThat(attempt.getOutcome()).isEqualTo(NodeAttempt.Outcome.CONNECTION_FAILURE);
        assertThat(attempt.getFailure()).isInstanceOf(TransportTimeoutException.class);
    }

    private HttpClusterTransport transport(ClusterSettings settings) {
        return new HttpClusterTransport(settings, Duration.ofSeconds(2), Duration.ofSeconds(5), metricsProvider);
    }

    private static void reply(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
