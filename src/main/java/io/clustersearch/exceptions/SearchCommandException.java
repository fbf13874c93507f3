package io.clustersearch.exceptions;

/**
 * Base class for every failure the search command reports to its caller.
 */
public class SearchCommandException extends RuntimeException {

    public SearchCommandException(String message) {
        super(message);
    }

    public SearchCommandException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether records emitted before this failure are still valid output.
     */
    public boolean isPartialResult() {
        return false;
    }
}
