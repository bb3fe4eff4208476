package org.javai.reattempt.retry;

import org.javai.reattempt.RequestError;
import org.javai.reattempt.Result;
import org.javai.reattempt.classify.FailureClassifier;
import org.javai.reattempt.ops.CompositeRetryReporter;
import org.javai.reattempt.ops.RetryReporter;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation and re-issues it transparently until it succeeds, fails in a
 * way no classifier accepts, or one of the attached policies stops the chain.
 * The caller only ever sees the final {@link Result}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * CompletableFuture<Result<User>> user = retrier.with(
 *     "UserApi.fetch",
 *     List.of(Policy.maxRetries(3), Policy.exponentialBackoff(500, 3_000)),
 *     List.of(FailureClassifier.onNetworkError(), FailureClassifier.onTimeout()),
 *     () -> userApi.fetch(userId)
 * );
 * }</pre>
 *
 * <p>The chain is bounded only by its policies. Attaching retriable classifiers without any
 * policy that eventually stops retries forever.
 */
public final class Retrier {

    static final String DEFAULT_OPERATION = "retry";

    private final RetryReporter reporter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Executor executor;

    private Retrier(RetryReporter reporter, Clock clock, Sleeper sleeper, Executor executor) {
        // A throwing reporter is logged and skipped; it never fails the chain
        this.reporter = CompositeRetryReporter.of(Objects.requireNonNull(reporter, "reporter must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Creates a Retrier with default settings: no reporting, the UTC system clock, a
     * scheduled sleeper and the common fork-join pool.
     */
    public static Retrier create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryReporter reporter = RetryReporter.noOp();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.scheduled();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the clock that time-bound policies read (optional, defaults to UTC system clock).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the sleeper interval policies suspend through.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the executor each re-attempt is dispatched on.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public Retrier build() {
            return new Retrier(reporter, clock, sleeper, executor);
        }
    }

    /**
     * Runs {@code operation} under the given policies and classifiers.
     *
     * @param policies Stopping rules, all advanced on every retriable failure
     * @param classifiers Which failures may be retried; an empty list retries nothing
     * @param operation Issues one attempt
     * @return the final result. Failures are data, never an exceptional completion; the
     *         future only completes exceptionally if the operation itself throws.
     */
    public <T> CompletableFuture<Result<T>> with(
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        return with(DEFAULT_OPERATION, policies, classifiers, operation);
    }

    /**
     * Like {@link #with(List, List, Supplier)}, naming the operation for reporting.
     */
    public <T> CompletableFuture<Result<T>> with(
            String name,
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Chain<T> chain = new Chain<>(
                name,
                List.copyOf(Objects.requireNonNull(classifiers, "classifiers must not be null")),
                operation,
                new TransitionContext(clock.instant(), clock, sleeper));
        List<Policy> initial = List.copyOf(Objects.requireNonNull(policies, "policies must not be null"));

        return CompletableFuture.completedFuture(null)
                .thenCompose(ignored -> attempt(chain, initial, 1));
    }

    private <T> CompletableFuture<Result<T>> attempt(Chain<T> chain, List<Policy> policies, int attemptNumber) {
        return invoke(chain.operation()).thenCompose(result -> {
            if (!(result instanceof Result.Failed<T> failed)) {
                return CompletableFuture.completedFuture(result);
            }
            RequestError error = failed.error();
            if (!FailureClassifier.matches(chain.classifiers(), error)) {
                reporter.reportNotRetriable(chain.name(), error, attemptNumber);
                return CompletableFuture.completedFuture(result);
            }

            return PolicyChain.advance(policies, chain.context(), error).thenComposeAsync(next -> {
                if (next instanceof Result.Succeeded<List<Policy>> proceed) {
                    reporter.reportRetryAttempt(chain.name(), error, attemptNumber);
                    return attempt(chain, proceed.data(), attemptNumber + 1);
                }
                reporter.reportRetryExhausted(chain.name(), error, attemptNumber);
                return CompletableFuture.completedFuture(result);
            }, executor);
        });
    }

    static <T> CompletableFuture<Result<T>> invoke(Supplier<? extends CompletionStage<Result<T>>> operation) {
        CompletionStage<Result<T>> stage = operation.get();
        return Objects.requireNonNull(stage, "operation returned a null stage").toCompletableFuture();
    }

    /**
     * What stays fixed across every attempt of one chain.
     */
    private record Chain<T>(
            String name,
            List<FailureClassifier> classifiers,
            Supplier<? extends CompletionStage<Result<T>>> operation,
            TransitionContext context
    ) {
    }
}
