package org.javai.reattempt.retry;

import org.javai.reattempt.RequestError;
import org.javai.reattempt.Result;
import org.javai.reattempt.classify.FailureClassifier;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The state of a resumable retry chain between two turns of the caller's control loop.
 *
 * <p>A context is plain data handed back to the caller; {@link ResumableRetrier} keeps no
 * reference to it. Each context is single-use: resume a {@link Suspended} context at most once,
 * and never resume a {@link Finished} one.
 *
 * @param <T> The type of the data carried by a successful result
 */
public sealed interface RetryContext<T> permits RetryContext.Suspended, RetryContext.Finished {

    /**
     * A retriable failure happened and the chain waits for the caller to resume it.
     * Taken before any policy was advanced for {@code lastError}.
     *
     * @param name The operation name used for reporting
     * @param startedAt When the first attempt of the chain began
     * @param lastError The failure the caller may act on before resuming
     * @param operation Issues one attempt
     * @param classifiers The chain's failure classifiers
     * @param policies The policies to advance on resume
     * @param attempts How many attempts have been made so far
     * @param onSuspend Receives the next suspension of this chain when resumed through the
     *                  host-facing {@link ResumableRetrier#resume(java.util.function.Function, Consumer, RetryContext)}
     */
    record Suspended<T>(
            String name,
            Instant startedAt,
            RequestError lastError,
            Supplier<? extends CompletionStage<Result<T>>> operation,
            List<FailureClassifier> classifiers,
            List<Policy> policies,
            int attempts,
            Consumer<Suspended<T>> onSuspend
    ) implements RetryContext<T> {

        public Suspended {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(startedAt, "startedAt must not be null");
            Objects.requireNonNull(lastError, "lastError must not be null");
            Objects.requireNonNull(operation, "operation must not be null");
            Objects.requireNonNull(onSuspend, "onSuspend must not be null");
            classifiers = List.copyOf(classifiers);
            policies = List.copyOf(policies);
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1");
            }
        }

        @Override
        public boolean isFinished() {
            return false;
        }
    }

    /**
     * The chain is over.
     *
     * @param result The terminal result
     */
    record Finished<T>(Result<T> result) implements RetryContext<T> {

        public Finished {
            Objects.requireNonNull(result, "result must not be null");
        }

        @Override
        public boolean isFinished() {
            return true;
        }
    }

    boolean isFinished();
}
