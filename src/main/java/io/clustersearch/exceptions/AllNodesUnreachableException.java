package io.clustersearch.exceptions;

/**
 * Thrown when every configured endpoint failed at the connection level.
 * The cause is the failure of the last endpoint tried.
 */
public class AllNodesUnreachableException extends SearchCommandException {

    private final int attempts;

    public AllNodesUnreachableException(int attempts, Throwable lastFailure) {
        super(String.format("All %d cluster node(s) unreachable, last error: %s",
                attempts, lastFailure != null ? lastFailure.getMessage() : "none"), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
