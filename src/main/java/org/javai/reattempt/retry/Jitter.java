package org.javai.reattempt.retry;

/**
 * Immutable pseudo-random state for backoff jitter.
 *
 * <p>A 48-bit linear congruential generator with the constants of {@link java.util.Random}, so
 * {@code Jitter.seeded(s)} draws the same sequence as {@code new Random(s).nextDouble()}.
 * Each draw returns the advanced state instead of mutating this one, which keeps a backoff
 * policy a plain value that can be copied, compared and replayed.
 *
 * @param state the scrambled 48-bit generator state
 */
public record Jitter(long state) {

    private static final long MULTIPLIER = 0x5DEECE66DL;
    private static final long ADDEND = 0xBL;
    private static final long MASK = (1L << 48) - 1;
    private static final double DOUBLE_UNIT = 0x1.0p-53;

    public Jitter {
        if ((state & ~MASK) != 0) {
            throw new IllegalArgumentException("state must fit in 48 bits, was: " + state);
        }
    }

    /**
     * Creates the state a {@link java.util.Random} constructed with {@code seed} starts from.
     */
    public static Jitter seeded(long seed) {
        return new Jitter((seed ^ MULTIPLIER) & MASK);
    }

    /**
     * Draws a value uniformly from {@code [0, 1)}.
     *
     * @return the value together with the state to use for the following draw
     */
    public Draw nextDouble() {
        long first = step(state);
        long second = step(first);
        long high = first >>> (48 - 26);
        long low = second >>> (48 - 27);
        return new Draw(((high << 27) + low) * DOUBLE_UNIT, new Jitter(second));
    }

    private static long step(long state) {
        return (state * MULTIPLIER + ADDEND) & MASK;
    }

    /**
     * A single draw.
     *
     * @param value the drawn value in {@code [0, 1)}
     * @param next the state after the draw
     */
    public record Draw(double value, Jitter next) {
    }
}
