package org.javai.reattempt.retry;

import org.javai.reattempt.RequestError;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A stopping rule for a retry chain.
 *
 * <p>A policy is an immutable value. Advancing it after a retriable failure yields either a
 * successor policy of the same kind ({@link RetryDecision.Continue}) or a veto
 * ({@link RetryDecision.Stop}). Interval policies complete their decision only after their
 * delay has passed, so the engine waits for them simply by waiting for the decision.
 *
 * <p>Several policies attached to one chain are independent: the engine advances all of them
 * for every retriable failure and retries only if every one continues.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * List<Policy> policies = List.of(
 *     Policy.maxRetries(5),
 *     Policy.maxDuration(10_000),
 *     Policy.exponentialBackoff(500, 3_000)
 * );
 * }</pre>
 */
public sealed interface Policy
        permits Policy.MaxRetries, Policy.MaxDuration, Policy.ConstantInterval, Policy.ExponentialBackoff {

    /**
     * A short description used in logs.
     */
    String id();

    /**
     * Advances this policy after a retriable failure.
     *
     * @param context The chain's start time, clock and sleeper
     * @param error The failure that triggered the retry
     * @return a stage completing with the decision, after any delay this policy imposes
     */
    CompletionStage<RetryDecision> advance(TransitionContext context, RequestError error);

    /**
     * Allows {@code remaining} more retries. Never sleeps.
     */
    record MaxRetries(int remaining) implements Policy {

        @Override
        public String id() {
            return "maxRetries(" + remaining + ")";
        }

        @Override
        public CompletionStage<RetryDecision> advance(TransitionContext context, RequestError error) {
            if (remaining <= 0) {
                return CompletableFuture.completedFuture(RetryDecision.Stop.because("retry count exhausted"));
            }
            return CompletableFuture.completedFuture(RetryDecision.Continue.with(new MaxRetries(remaining - 1)));
        }
    }

    /**
     * Stops once {@code limit} has elapsed since the first attempt. Never sleeps, so pair it
     * with an interval policy unless immediate retries are wanted.
     */
    record MaxDuration(Duration limit) implements Policy {

        public MaxDuration {
            Objects.requireNonNull(limit, "limit must not be null");
            if (limit.isNegative()) {
                throw new IllegalArgumentException("limit must not be negative");
            }
        }

        @Override
        public String id() {
            return "maxDuration(" + limit.toMillis() + "ms)";
        }

        @Override
        public CompletionStage<RetryDecision> advance(TransitionContext context, RequestError error) {
            Duration elapsed = context.elapsed();
            if (elapsed.compareTo(limit) >= 0) {
                return CompletableFuture.completedFuture(RetryDecision.Stop.because(
                        "elapsed " + elapsed.toMillis() + "ms reached limit of " + limit.toMillis() + "ms"));
            }
            return CompletableFuture.completedFuture(RetryDecision.Continue.with(this));
        }
    }

    /**
     * Always continues, after sleeping exactly {@code interval}.
     */
    record ConstantInterval(Duration interval) implements Policy {

        public ConstantInterval {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isNegative()) {
                throw new IllegalArgumentException("interval must not be negative");
            }
        }

        @Override
        public String id() {
            return "constantInterval(" + interval.toMillis() + "ms)";
        }

        @Override
        public CompletionStage<RetryDecision> advance(TransitionContext context, RequestError error) {
            return context.sleeper().sleep(interval)
                    .thenApply(ignored -> RetryDecision.Continue.with(this));
        }
    }

    /**
     * Always continues, after sleeping the current interval. The successor's interval is
     * drawn by {@link BackoffGenerator} and capped at {@code maxIntervalMillis}.
     *
     * @param intervalMillis the interval to sleep on the next transition
     * @param maxIntervalMillis the cap for every following interval
     * @param jitter the generator state for the next draw
     */
    record ExponentialBackoff(double intervalMillis, double maxIntervalMillis, Jitter jitter) implements Policy {

        public ExponentialBackoff {
            Objects.requireNonNull(jitter, "jitter must not be null");
            if (!(intervalMillis >= 0)) {
                throw new IllegalArgumentException("interval must be >= 0, was: " + intervalMillis);
            }
            if (!(maxIntervalMillis >= intervalMillis)) {
                throw new IllegalArgumentException(
                        "maxInterval must be >= interval, was: " + maxIntervalMillis + " < " + intervalMillis);
            }
        }

        @Override
        public String id() {
            return "exponentialBackoff(" + Math.round(intervalMillis) + "ms, max " + Math.round(maxIntervalMillis) + "ms)";
        }

        @Override
        public CompletionStage<RetryDecision> advance(TransitionContext context, RequestError error) {
            BackoffGenerator.Step step = BackoffGenerator.next(intervalMillis, maxIntervalMillis, jitter);
            Policy successor = new ExponentialBackoff(step.interval(), maxIntervalMillis, step.jitter());
            return context.sleeper().sleep(Duration.ofMillis(Math.round(intervalMillis)))
                    .thenApply(ignored -> RetryDecision.Continue.with(successor));
        }
    }

    // === FACTORIES ===

    /**
     * Allows at most {@code count} retries after the first attempt. Zero or less stops on the
     * first retriable failure.
     */
    static Policy maxRetries(int count) {
        return new MaxRetries(count);
    }

    /**
     * Stops once {@code milliseconds} have elapsed since the first attempt.
     */
    static Policy maxDuration(long milliseconds) {
        return new MaxDuration(Duration.ofMillis(milliseconds));
    }

    static Policy maxDuration(Duration limit) {
        return new MaxDuration(limit);
    }

    /**
     * Waits {@code milliseconds} before every retry.
     */
    static Policy constantInterval(long milliseconds) {
        return new ConstantInterval(Duration.ofMillis(milliseconds));
    }

    static Policy constantInterval(Duration interval) {
        return new ConstantInterval(interval);
    }

    /**
     * Waits {@code interval} before the first retry and a jittered, growing interval capped at
     * {@code maxInterval} before each later one. Every fresh policy starts from seed 0.
     */
    static Policy exponentialBackoff(double interval, double maxInterval) {
        return exponentialBackoff(interval, maxInterval, 0L);
    }

    /**
     * Like {@link #exponentialBackoff(double, double)} with an explicit jitter seed.
     */
    static Policy exponentialBackoff(double interval, double maxInterval, long seed) {
        return new ExponentialBackoff(interval, maxInterval, Jitter.seeded(seed));
    }
}
