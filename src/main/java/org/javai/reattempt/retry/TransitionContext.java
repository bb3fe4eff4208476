package org.javai.reattempt.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * What a policy sees when it is advanced after a retriable failure.
 *
 * @param startedAt When the first attempt of the chain began; never changes within a chain
 * @param clock The clock used to read the current time
 * @param sleeper The sleeper interval policies suspend through
 */
public record TransitionContext(Instant startedAt, Clock clock, Sleeper sleeper) {

    public TransitionContext {
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Time elapsed between the first attempt and now.
     */
    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }
}
