package org.javai.reattempt.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Suspends a retry chain without blocking a thread.
 * Interval policies ask for their delay through this; tests substitute one that completes
 * immediately and records what was asked.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Returns a stage that completes once {@code duration} has passed.
     */
    CompletionStage<Void> sleep(Duration duration);

    /**
     * A sleeper backed by {@link CompletableFuture#delayedExecutor}.
     */
    static Sleeper scheduled() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> {},
                    CompletableFuture.delayedExecutor(duration.toNanos(), TimeUnit.NANOSECONDS));
        };
    }
}
