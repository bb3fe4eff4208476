package org.javai.reattempt.ops;

import org.javai.reattempt.RequestError;

/**
 * Observes retry chains for logging and metrics.
 * All methods default to no-ops; implementations override what they care about.
 *
 * <p>{@code operation} is the name the caller gave the chain, or {@code "retry"} if none.
 */
public interface RetryReporter {

    /**
     * Reports that a retriable failure is about to be retried.
     *
     * @param operation The operation name
     * @param error The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     */
    default void reportRetryAttempt(String operation, RequestError error, int attemptNumber) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a policy vetoed further retries.
     *
     * @param operation The operation name
     * @param error The final failure, returned to the caller unchanged
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(String operation, RequestError error, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a failure that no classifier accepted.
     *
     * @param operation The operation name
     * @param error The failure, returned to the caller unchanged
     * @param attemptNumber The attempt that failed (1-based)
     */
    default void reportNotRetriable(String operation, RequestError error, int attemptNumber) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a resumable chain handed control back to its caller.
     *
     * @param operation The operation name
     * @param error The failure the caller will see in the suspended context
     * @param attemptNumber The attempt that failed (1-based)
     */
    default void reportSuspended(String operation, RequestError error, int attemptNumber) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static RetryReporter noOp() {
        return new RetryReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
