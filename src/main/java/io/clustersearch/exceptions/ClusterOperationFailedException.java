package io.clustersearch.exceptions;

/**
 * Thrown when the cluster answered but rejected the request (bad query syntax, missing index, ...).
 * Never retried on another node.
 */
public class ClusterOperationFailedException extends SearchCommandException {

    private final int status;
    private final String errorType;

    public ClusterOperationFailedException(int status, String errorType, String message) {
        super(message);
        this.status = status;
        this.errorType = errorType;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorType() {
        return errorType;
    }
}
