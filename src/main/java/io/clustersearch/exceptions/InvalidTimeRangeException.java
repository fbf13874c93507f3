package io.clustersearch.exceptions;

import java.time.Instant;

/**
 * Thrown when a resolved range starts after it ends.
 */
public class InvalidTimeRangeException extends SearchCommandException {

    public InvalidTimeRangeException(Instant start, Instant end) {
        super(String.format("Invalid time range: earliest %s is after latest %s", start, end));
    }
}
