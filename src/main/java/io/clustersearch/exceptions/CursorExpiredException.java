package io.clustersearch.exceptions;

/**
 * Thrown when the cluster no longer knows the scroll cursor. Records already emitted remain valid,
 * but the result set is incomplete.
 */
public class CursorExpiredException extends SearchCommandException {

    public CursorExpiredException(String message) {
        super(message);
    }

    @Override
    public boolean isPartialResult() {
        return true;
    }
}
