package io.clustersearch.transport;

import io.clustersearch.config.ClusterSettings;
import io.clustersearch.exceptions.ClusterOperationFailedException;
import io.clustersearch.exceptions.SearchCommandException;
import io.clustersearch.exceptions.TransportTimeoutException;
import io.clustersearch.metrics.MetricsProvider;
import io.clustersearch.models.ClusterEndpoint;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.ConnectException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Set;

import static io.clustersearch.metrics.MetricsConstants.CLUSTER_REQUESTS_METRIC_NAME;
import static io.clustersearch.metrics.MetricsConstants.ENDPOINT_TAG;
import static io.clustersearch.metrics.MetricsConstants.OUTCOME_TAG;

/**
 * {@link ClusterTransport} over the JDK HTTP client.
 * TLS verification and credentials are fixed when the transport is built.
 */
@Slf4j
public class HttpClusterTransport implements ClusterTransport {

    // Statuses a proxy or overloaded node answers with; the next node may still serve the request
    private static final Set<Integer> NODE_UNAVAILABLE_STATUSES = Set.of(502, 503, 504);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String authorization;
    private final MetricsProvider metricsProvider;

    public HttpClusterTransport(ClusterSettings settings, Duration connectTimeout, Duration requestTimeout,
                                MetricsProvider metricsProvider) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER);
        if (settings.isUseSsl() && !settings.isVerifyCerts()) {
            log.warn("Certificate verification disabled for cluster {}", settings.getHosts());
            builder.sslContext(insecureSslContext());
        }
        this.httpClient = builder.build();
        this.requestTimeout = requestTimeout;
        this.authorization = settings.hasCredentials() ? basicAuthorization(settings) : null;
        this.metricsProvider = metricsProvider;
    }

    @Override
    public NodeAttempt<ClusterResponse> execute(ClusterEndpoint endpoint, ClusterRequest request) {
        String targetUrl = endpoint.baseUrl() + request.getPath();
        log.debug("Sending {} {} (body size: {} bytes)", request.getMethod(), targetUrl,
                request.getBody() != null ? request.getBody().length() : 0);

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(targetUrl))
            .timeout(requestTimeout)
            .header("Accept", "application/json");
        if (authorization != null) {
            requestBuilder.header("Authorization", authorization);
        }
        if (request.getBody() != null && !request.getBody().isEmpty()) {
            requestBuilder.header("Content-Type", "application/json");
            requestBuilder.method(request.getMethod(), HttpRequest.BodyPublishers.ofString(request.getBody()));
        } else {
            requestBuilder.method(request.getMethod(), HttpRequest.BodyPublishers.noBody());
        }

        long startTime = System.nanoTime();
        NodeAttempt<ClusterResponse> attempt = send(endpoint, targetUrl, requestBuilder.build());
        metricsProvider.timer(CLUSTER_REQUESTS_METRIC_NAME,
                Map.of(ENDPOINT_TAG, endpoint.baseUrl(), OUTCOME_TAG, attempt.getOutcome().name().toLowerCase()))
            .record(Duration.ofNanos(System.nanoTime() - startTime));
        return attempt;
    }

    private NodeAttempt<ClusterResponse> send(ClusterEndpoint endpoint, String targetUrl, HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("Response received from {}: status={}, body size={} bytes", endpoint,
                    response.statusCode(), response.body() != null ? response.body().length() : 0);

            if (NODE_UNAVAILABLE_STATUSES.contains(response.statusCode())) {
                log.warn("Node {} answered {} for {}, treating node as unavailable", endpoint, response.statusCode(), targetUrl);
                return NodeAttempt.connectionFailure(new ClusterOperationFailedException(response.statusCode(),
                        "node_unavailable", String.format("Node %s answered HTTP %d", endpoint, response.statusCode())));
            }
            return NodeAttempt.success(new ClusterResponse(response.statusCode(), response.body()));

        } catch (HttpConnectTimeoutException e) {
            log.warn("Connect to {} timed out: {}", endpoint, e.getMessage());
            return NodeAttempt.connectionFailure(
                    new TransportTimeoutException(String.format("Connect to %s timed out", endpoint), e));
        } catch (HttpTimeoutException e) {
            log.warn("Request to {} timed out after {}: {}", targetUrl, requestTimeout, e.getMessage());
            return NodeAttempt.connectionFailure(
                    new TransportTimeoutException(String.format("Request to %s timed out after %s", endpoint, requestTimeout), e));
        } catch (ConnectException e) {
            log.warn("Failed to connect to {}: {}", endpoint, e.getMessage());
            return NodeAttempt.connectionFailure(e);
        } catch (SSLException e) {
            log.warn("TLS handshake with {} failed: {}", endpoint, e.getMessage());
            return NodeAttempt.connectionFailure(e);
        } catch (IOException e) {
            log.warn("I/O error talking to {}: {} ({})", endpoint, e.getMessage(), e.getClass().getSimpleName());
            return NodeAttempt.connectionFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchCommandException("Interrupted while waiting for " + targetUrl, e);
        }
    }

    private static String basicAuthorization(ClusterSettings settings) {
        String password = settings.getPassword() != null ? settings.getPassword() : "";
        String token = settings.getUser() + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    private static SSLContext insecureSslContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to create TLS context without certificate verification", e);
        }
    }

    /**
     * Accepts every certificate and host name. Only used when verify_certs is off.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
