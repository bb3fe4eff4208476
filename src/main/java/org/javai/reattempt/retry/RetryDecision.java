package org.javai.reattempt.retry;

import java.util.Objects;

/**
 * The outcome of advancing one policy after a retriable failure.
 */
public sealed interface RetryDecision permits RetryDecision.Continue, RetryDecision.Stop {

    /**
     * The policy allows another attempt; {@code next} replaces it for the rest of the chain.
     */
    record Continue(Policy next) implements RetryDecision {
        public Continue {
            Objects.requireNonNull(next, "next must not be null");
        }

        public static Continue with(Policy next) {
            return new Continue(next);
        }
    }

    /**
     * The policy vetoes any further attempt.
     */
    record Stop(String reason) implements RetryDecision {
        public Stop() {
            this(null);
        }

        public static Stop because(String reason) {
            return new Stop(reason);
        }
    }
}
