package io.clustersearch.exceptions;

/**
 * A request to one endpoint exceeded the per-attempt timeout. Counted as a connection failure.
 */
public class TransportTimeoutException extends SearchCommandException {

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
