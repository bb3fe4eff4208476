package org.javai.reattempt.classify;

import org.javai.reattempt.RequestError;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failure is eligible for retry at all.
 *
 * <p>A list of classifiers is read as a logical OR: a failure is retriable when at least one
 * classifier accepts it. An empty list accepts nothing, so attaching policies without any
 * classifier never retries.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * List<FailureClassifier> classifiers = List.of(
 *     FailureClassifier.onNetworkError(),
 *     FailureClassifier.onTimeout(),
 *     FailureClassifier.onStatus(503)
 * );
 * }</pre>
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Tests a single failure.
     *
     * @param error The failure reported by the operation
     * @return true if this classifier considers the failure retriable
     */
    boolean accepts(RequestError error);

    /**
     * Returns a classifier accepting whatever this one or {@code other} accepts.
     */
    default FailureClassifier or(FailureClassifier other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> accepts(error) || other.accepts(error);
    }

    /**
     * Evaluates a list of classifiers against a failure.
     *
     * @param classifiers The classifiers attached to a retry chain
     * @param error The failure to test
     * @return true iff at least one classifier accepts the failure
     */
    static boolean matches(List<FailureClassifier> classifiers, RequestError error) {
        Objects.requireNonNull(classifiers, "classifiers must not be null");
        Objects.requireNonNull(error, "error must not be null");
        if (error.isPlaceholder()) {
            return false;
        }
        for (FailureClassifier classifier : classifiers) {
            if (classifier.accepts(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Accepts a bad-status failure with exactly the given status code.
     */
    static FailureClassifier onStatus(int code) {
        return error -> error instanceof RequestError.BadStatus badStatus && badStatus.code() == code;
    }

    /**
     * Accepts 401 Unauthorized responses, typically retried after refreshing a credential.
     */
    static FailureClassifier onUnauthenticatedStatus() {
        return onStatus(401);
    }

    /**
     * Accepts 403 Forbidden responses.
     */
    static FailureClassifier onUnauthorizedStatus() {
        return onStatus(403);
    }

    static FailureClassifier onNetworkError() {
        return error -> error instanceof RequestError.NetworkUnreachable;
    }

    static FailureClassifier onTimeout() {
        return error -> error instanceof RequestError.TimedOut;
    }

    /**
     * Accepts every failure.
     */
    static FailureClassifier onAllFailures() {
        return error -> true;
    }
}
