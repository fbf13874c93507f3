package io.clustersearch.models;

import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import lombok.Value;

import java.net.URI;
import java.net.URISyntaxException;

import static io.clustersearch.config.Constants.DEFAULT_PORT;

/**
 * One HTTP entry point of the search cluster.
 */
@Value
public class ClusterEndpoint {

    String host;
    int port;
    boolean secure;

    /**
     * Parse an endpoint declaration: {@code host}, {@code host:port}, {@code http://host:port} or
     * {@code https://host:port}. Without a scheme the endpoint is secure when {@code useSsl} is set.
     *
     * @throws InvalidQueryConfigurationException if the declaration is not a valid host/port
     */
    public static ClusterEndpoint parse(String declaration, boolean useSsl) {
        if (declaration == null || declaration.trim().isEmpty()) {
            throw new InvalidQueryConfigurationException("Cluster endpoint cannot be null or empty");
        }
        String trimmed = declaration.trim();
        boolean hasScheme = trimmed.contains("://");
        String withScheme = hasScheme ? trimmed : (useSsl ? "https://" : "http://") + trimmed;

        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new InvalidQueryConfigurationException("Invalid cluster endpoint '" + trimmed + "'", e);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase() : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidQueryConfigurationException(
                    String.format("Invalid cluster endpoint '%s': unsupported scheme '%s'", trimmed, scheme));
        }
        boolean secure = scheme.equals("https");
        if (uri.getHost() == null) {
            // URI rejects hostnames such as "es_node" that are valid for DNS and container networks
            return fromAuthority(trimmed, uri.getRawAuthority(), secure);
        }
        if (uri.getHost().isEmpty()) {
            throw hostMissing(trimmed);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        return new ClusterEndpoint(uri.getHost(), port, secure);
    }

    private static ClusterEndpoint fromAuthority(String declaration, String authority, boolean secure) {
        if (authority == null || authority.isEmpty() || authority.contains("@") || authority.startsWith("[")) {
            throw hostMissing(declaration);
        }
        int separator = authority.lastIndexOf(':');
        String host = separator >= 0 ? authority.substring(0, separator) : authority;
        if (host.isEmpty()) {
            throw hostMissing(declaration);
        }
        int port = DEFAULT_PORT;
        if (separator >= 0) {
            try {
                port = Integer.parseInt(authority.substring(separator + 1));
            } catch (NumberFormatException e) {
                throw new InvalidQueryConfigurationException(
                        String.format("Invalid cluster endpoint '%s': bad port", declaration), e);
            }
            if (port < 1 || port > 65535) {
                throw new InvalidQueryConfigurationException(
                        String.format("Invalid cluster endpoint '%s': bad port", declaration));
            }
        }
        return new ClusterEndpoint(host, port, secure);
    }

    private static InvalidQueryConfigurationException hostMissing(String declaration) {
        return new InvalidQueryConfigurationException(
                String.format("Invalid cluster endpoint '%s': host is missing", declaration));
    }

    /**
     * @return base URL, e.g. {@code https://10.0.0.5:9200}
     */
    public String baseUrl() {
        return (secure ? "https" : "http") + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return baseUrl();
    }
}
