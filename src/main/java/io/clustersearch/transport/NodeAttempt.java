package io.clustersearch.transport;

import io.clustersearch.exceptions.SearchCommandException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of running one operation against one endpoint.
 *
 * <ul>
 *   <li><strong>SUCCESS</strong> - the operation produced a value</li>
 *   <li><strong>CONNECTION_FAILURE</strong> - the node could not be reached, another node may be tried</li>
 *   <li><strong>QUERY_FAILURE</strong> - the cluster rejected the request, no other node is tried</li>
 * </ul>
 */
public final class NodeAttempt<T> {

    public enum Outcome {
        SUCCESS,
        CONNECTION_FAILURE,
        QUERY_FAILURE
    }

    private final Outcome outcome;
    private final T value;
    private final Throwable failure;

    private NodeAttempt(Outcome outcome, T value, Throwable failure) {
        this.outcome = outcome;
        this.value = value;
        this.failure = failure;
    }

    public static <T> NodeAttempt<T> success(T value) {
        return new NodeAttempt<>(Outcome.SUCCESS, value, null);
    }

    public static <T> NodeAttempt<T> connectionFailure(Throwable cause) {
        return new NodeAttempt<>(Outcome.CONNECTION_FAILURE, null, Objects.requireNonNull(cause, "cause"));
    }

    public static <T> NodeAttempt<T> queryFailure(SearchCommandException cause) {
        return new NodeAttempt<>(Outcome.QUERY_FAILURE, null, Objects.requireNonNull(cause, "cause"));
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public T getValue() {
        return value;
    }

    public Throwable getFailure() {
        return failure;
    }

    /**
     * Continue with the value of a successful attempt; failures are passed through unchanged.
     */
    @SuppressWarnings("unchecked")
    public <R> NodeAttempt<R> then(Function<T, NodeAttempt<R>> next) {
        if (outcome != Outcome.SUCCESS) {
            return (NodeAttempt<R>) this;
        }
        return next.apply(value);
    }

    @Override
    public String toString() {
        return outcome == Outcome.SUCCESS ? "NodeAttempt[SUCCESS]" : "NodeAttempt[" + outcome + ": " + failure + "]";
    }
}
