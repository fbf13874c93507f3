package io.clustersearch.command;

import io.clustersearch.config.ClusterSettings;
import io.clustersearch.transport.ClusterTransport;

/**
 * Creates the transport of one command invocation.
 */
@FunctionalInterface
public interface TransportFactory {

    ClusterTransport create(ClusterSettings settings);
}
