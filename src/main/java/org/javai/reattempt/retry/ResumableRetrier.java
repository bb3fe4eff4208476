package org.javai.reattempt.retry;

import org.javai.reattempt.RequestError;
import org.javai.reattempt.Result;
import org.javai.reattempt.classify.FailureClassifier;
import org.javai.reattempt.ops.CompositeRetryReporter;
import org.javai.reattempt.ops.RetryReporter;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A retry engine that hands control back to its caller after every retriable failure.
 *
 * <p>Decisions are the same as {@link Retrier}'s, but instead of looping internally the engine
 * returns a {@link RetryContext.Suspended} context. The caller can run a side effect, for
 * example refreshing a credential, and then {@linkplain #resume resume} the chain: the policies
 * are advanced, the side effect runs, and the next attempt is issued. A caller that never
 * resumes simply abandons the chain.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResumableRetrier retrier = ResumableRetrier.create();
 *
 * RetryContext<Profile> context = retrier.start(
 *     List.of(Policy.maxRetries(1)),
 *     List.of(FailureClassifier.onUnauthenticatedStatus()),
 *     () -> profileApi.fetch(token.get())
 * ).join();
 *
 * while (context instanceof RetryContext.Suspended<Profile> suspended) {
 *     context = retrier.resume(error -> tokens.refresh(), suspended).join();
 * }
 * }</pre>
 */
public final class ResumableRetrier {

    private final RetryReporter reporter;
    private final Clock clock;
    private final Sleeper sleeper;

    private ResumableRetrier(RetryReporter reporter, Clock clock, Sleeper sleeper) {
        // A throwing reporter is logged and skipped; it never fails the chain
        this.reporter = CompositeRetryReporter.of(Objects.requireNonNull(reporter, "reporter must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public static ResumableRetrier create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a ResumableRetrier instance.
     */
    public static final class Builder {
        private RetryReporter reporter = RetryReporter.noOp();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.scheduled();

        private Builder() {}

        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ResumableRetrier build() {
            return new ResumableRetrier(reporter, clock, sleeper);
        }
    }

    /**
     * Issues the first attempt of a new chain.
     *
     * @return {@link RetryContext.Finished} if the attempt did not fail retriably, otherwise a
     *         fresh {@link RetryContext.Suspended}
     */
    public <T> CompletableFuture<RetryContext<T>> start(
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        return start(Retrier.DEFAULT_OPERATION, policies, classifiers, suspended -> {}, operation);
    }

    /**
     * Issues the first attempt of a new chain, delivering a suspension to {@code onSuspend}.
     * The same handler receives every later suspension of the chain that is resumed through
     * {@link #resume(Function, Consumer, RetryContext)}.
     *
     * @return the context after the first attempt; a finished chain is visible only here
     */
    public <T> CompletableFuture<RetryContext<T>> resumableWith(
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Consumer<RetryContext.Suspended<T>> onSuspend,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        return resumableWith(Retrier.DEFAULT_OPERATION, policies, classifiers, onSuspend, operation);
    }

    /**
     * Like {@link #resumableWith(List, List, Consumer, Supplier)}, naming the operation for reporting.
     */
    public <T> CompletableFuture<RetryContext<T>> resumableWith(
            String name,
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Consumer<RetryContext.Suspended<T>> onSuspend,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        return start(name, policies, classifiers, onSuspend, operation)
                .thenApply(context -> deliver(context, onSuspend, result -> {}));
    }

    private <T> CompletableFuture<RetryContext<T>> start(
            String name,
            List<Policy> policies,
            List<FailureClassifier> classifiers,
            Consumer<RetryContext.Suspended<T>> onSuspend,
            Supplier<? extends CompletionStage<Result<T>>> operation
    ) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(policies, "policies must not be null");
        Objects.requireNonNull(classifiers, "classifiers must not be null");
        Objects.requireNonNull(onSuspend, "onSuspend must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Instant startedAt = clock.instant();

        return CompletableFuture.completedFuture(null)
                .thenCompose(ignored -> Retrier.invoke(operation))
                .thenApply(result -> settle(result, name, startedAt, operation, classifiers, policies, 1, onSuspend));
    }

    /**
     * Advances a suspended chain by one step.
     *
     * <p>The policies are advanced exactly as {@link Retrier} would advance them. If any stops,
     * the chain finishes with the suspended failure. Otherwise {@code sideEffect} runs with that
     * failure, and once it completes the next attempt is issued.
     *
     * @param sideEffect Work to do before the next attempt; its completion value is ignored
     * @param context A {@link RetryContext.Suspended} context
     * @return the next context
     * @throws IllegalStateException if {@code context} is already finished
     */
    public <T> CompletableFuture<RetryContext<T>> resume(
            Function<? super RequestError, ? extends CompletionStage<?>> sideEffect,
            RetryContext<T> context
    ) {
        Objects.requireNonNull(sideEffect, "sideEffect must not be null");
        RetryContext.Suspended<T> suspended = requireSuspended(context);
        RequestError lastError = suspended.lastError();
        TransitionContext transition = new TransitionContext(suspended.startedAt(), clock, sleeper);

        return PolicyChain.advance(suspended.policies(), transition, lastError).thenCompose(next -> {
            if (!(next instanceof Result.Succeeded<List<Policy>> proceed)) {
                reporter.reportRetryExhausted(suspended.name(), lastError, suspended.attempts());
                return CompletableFuture.<RetryContext<T>>completedFuture(
                        new RetryContext.Finished<>(Result.failed(lastError)));
            }
            reporter.reportRetryAttempt(suspended.name(), lastError, suspended.attempts());
            return sideEffect.apply(lastError).toCompletableFuture()
                    .thenCompose(ignored -> Retrier.invoke(suspended.operation()))
                    .thenApply(result -> settle(
                            result,
                            suspended.name(),
                            suspended.startedAt(),
                            suspended.operation(),
                            suspended.classifiers(),
                            proceed.data(),
                            suspended.attempts() + 1,
                            suspended.onSuspend()));
        });
    }

    /**
     * Host-facing resume: like {@link #resume(Function, RetryContext)}, but delivers a finished
     * result to {@code onFinished} and a new suspension to the handler the chain was started
     * with.
     *
     * @throws IllegalStateException if {@code context} is already finished
     */
    public <T> CompletableFuture<RetryContext<T>> resume(
            Function<? super RequestError, ? extends CompletionStage<?>> sideEffect,
            Consumer<Result<T>> onFinished,
            RetryContext<T> context
    ) {
        Objects.requireNonNull(onFinished, "onFinished must not be null");
        RetryContext.Suspended<T> suspended = requireSuspended(context);
        return resume(sideEffect, suspended)
                .thenApply(next -> deliver(next, suspended.onSuspend(), onFinished));
    }

    private <T> RetryContext<T> settle(
            Result<T> result,
            String name,
            Instant startedAt,
            Supplier<? extends CompletionStage<Result<T>>> operation,
            List<FailureClassifier> classifiers,
            List<Policy> policies,
            int attempts,
            Consumer<RetryContext.Suspended<T>> onSuspend
    ) {
        if (!(result instanceof Result.Failed<T> failed)) {
            return new RetryContext.Finished<>(result);
        }
        RequestError error = failed.error();
        if (!FailureClassifier.matches(classifiers, error)) {
            reporter.reportNotRetriable(name, error, attempts);
            return new RetryContext.Finished<>(result);
        }
        reporter.reportSuspended(name, error, attempts);
        return new RetryContext.Suspended<>(name, startedAt, error, operation, classifiers, policies, attempts, onSuspend);
    }

    private static <T> RetryContext<T> deliver(
            RetryContext<T> context,
            Consumer<RetryContext.Suspended<T>> onSuspend,
            Consumer<Result<T>> onFinished
    ) {
        if (context instanceof RetryContext.Suspended<T> suspended) {
            onSuspend.accept(suspended);
        } else if (context instanceof RetryContext.Finished<T> finished) {
            onFinished.accept(finished.result());
        }
        return context;
    }

    private static <T> RetryContext.Suspended<T> requireSuspended(RetryContext<T> context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context instanceof RetryContext.Suspended<T> suspended) {
            return suspended;
        }
        throw new IllegalStateException("Cannot resume a finished retry chain");
    }
}
