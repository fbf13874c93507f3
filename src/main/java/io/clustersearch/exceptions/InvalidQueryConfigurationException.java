package io.clustersearch.exceptions;

/**
 * Thrown for missing or malformed command options, before any request reaches the cluster.
 */
public class InvalidQueryConfigurationException extends SearchCommandException {

    public InvalidQueryConfigurationException(String message) {
        super(message);
    }

    public InvalidQueryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
