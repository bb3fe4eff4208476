package org.javai.reattempt.retry;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the jittered, capped interval sequence behind {@link Policy#exponentialBackoff}.
 *
 * <p>Given the current interval {@code c}, the next one is
 * {@code min(max, 1.5 * (lo + r * (hi - lo + 1)))} with {@code lo = 0.5c}, {@code hi = 1.5c}
 * and {@code r} drawn uniformly from {@code [0, 1)}.
 */
public final class BackoffGenerator {

    static final double RANDOMIZATION_FACTOR = 0.5;
    static final double MULTIPLIER = 1.5;

    private BackoffGenerator() {
        // Utility class
    }

    /**
     * One step of the sequence.
     *
     * @param interval the next interval in milliseconds
     * @param jitter the generator state after the draw
     */
    public record Step(double interval, Jitter jitter) {
    }

    /**
     * Computes the interval that follows {@code currentInterval}.
     *
     * @param currentInterval the interval just slept, in milliseconds
     * @param maxInterval the cap, in milliseconds
     * @param jitter the generator state to draw from
     * @return the next interval and the advanced generator state
     */
    public static Step next(double currentInterval, double maxInterval, Jitter jitter) {
        Jitter.Draw draw = jitter.nextDouble();
        double delta = RANDOMIZATION_FACTOR * currentInterval;
        double lowerBound = currentInterval - delta;
        double upperBound = currentInterval + delta;
        double raw = MULTIPLIER * (lowerBound + draw.value() * (upperBound - lowerBound + 1));
        return new Step(Math.min(raw, maxInterval), draw.next());
    }

    /**
     * Lists the first {@code count} suspensions a fresh backoff policy would make.
     * The first element is always {@code interval} itself.
     */
    public static List<Double> preview(double interval, double maxInterval, long seed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, was: " + count);
        }
        List<Double> intervals = new ArrayList<>(count);
        double current = interval;
        Jitter jitter = Jitter.seeded(seed);
        for (int i = 0; i < count; i++) {
            intervals.add(current);
            Step step = next(current, maxInterval, jitter);
            current = step.interval();
            jitter = step.jitter();
        }
        return intervals;
    }
}
