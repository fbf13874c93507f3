package io.clustersearch.scroll;

/**
 * Lifecycle of a {@link ScrollIterator}.
 *
 * UNOPENED → OPEN (initial search sent) → EXHAUSTED (empty page seen) → CLOSED (cursor released).
 * OPEN moves straight to CLOSED on close or when the cursor expired.
 */
public enum ScrollState {
    UNOPENED,
    OPEN,
    EXHAUSTED,
    CLOSED
}
