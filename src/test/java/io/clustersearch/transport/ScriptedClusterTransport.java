package io.clustersearch.transport;

import io.clustersearch.models.ClusterEndpoint;
import io.clustersearch.models.ClusterRequest;
import io.clustersearch.models.ClusterResponse;
import lombok.Value;

import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory cluster for tests. Responses are queued per method and path prefix; the last queued
 * response of a route is repeated. Hosts marked down refuse connections.
 */
public class ScriptedClusterTransport implements ClusterTransport {

    private final Set<String> downHosts = new HashSet<>();
    private final List<Route> routes = new ArrayList<>();
    private final List<RecordedRequest> requests = new ArrayList<>();

    public ScriptedClusterTransport nodeDown(String host) {
        downHosts.add(host);
        return this;
    }

    public ScriptedClusterTransport nodeUp(String host) {
        downHosts.remove(host);
        return this;
    }

    public ScriptedClusterTransport respond(String method, String pathPrefix, int status, String body) {
        Route route = routes.stream()
            .filter(r -> r.method.equals(method) && r.pathPrefix.equals(pathPrefix))
            .findFirst()
            .orElseGet(() -> {
                Route created = new Route(method, pathPrefix);
                routes.add(created);
                return created;
            });
        route.responses.add(new ClusterResponse(status, body));
        return this;
    }

    @Override
    public NodeAttempt<ClusterResponse> execute(ClusterEndpoint endpoint, ClusterRequest request) {
        requests.add(new RecordedRequest(endpoint, request));
        if (downHosts.contains(endpoint.getHost())) {
            return NodeAttempt.connectionFailure(new ConnectException("Connection refused: " + endpoint));
        }
        for (Route route : routes) {
            if (route.method.equals(request.getMethod()) && request.getPath().startsWith(route.pathPrefix)) {
                ClusterResponse response = route.responses.size() > 1 ? route.responses.poll() : route.responses.peek();
                return NodeAttempt.success(response);
            }
        }
        return NodeAttempt.success(new ClusterResponse(404,
            "{\"error\":{\"type\":\"no_route\",\"reason\":\"no scripted response\"},\"status\":404}"));
    }

    public List<RecordedRequest> getRequests() {
        return requests;
    }

    public List<RecordedRequest> requestsTo(String method, String pathPrefix) {
        return requests.stream()
            .filter(r -> r.getRequest().getMethod().equals(method) && r.getRequest().getPath().startsWith(pathPrefix))
            .collect(Collectors.toList());
    }

    @Value
    public static class RecordedRequest {
        ClusterEndpoint endpoint;
        ClusterRequest request;
    }

    private static final class Route {
        private final String method;
        private final String pathPrefix;
        private final Deque<ClusterResponse> responses = new ArrayDeque<>();

        private Route(String method, String pathPrefix) {
            this.method = method;
            this.pathPrefix = pathPrefix;
        }
    }
}
