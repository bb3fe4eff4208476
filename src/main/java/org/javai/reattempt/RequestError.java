package org.javai.reattempt;

import java.util.Objects;

/**
 * The failure carried by a {@link Result.Failed} result.
 *
 * <p>Transport adapters map whatever their client throws or returns onto one of these
 * variants. Failure classifiers inspect them to decide whether a failure is worth retrying.
 */
public sealed interface RequestError
        permits RequestError.BadStatus, RequestError.NetworkUnreachable, RequestError.TimedOut,
                RequestError.BadUrl, RequestError.BadBody, RequestError.CustomError {

    /**
     * The server answered with a non-success status code.
     *
     * @param code the HTTP status code
     */
    record BadStatus(int code) implements RequestError {
    }

    /**
     * The remote end could not be reached at all.
     */
    record NetworkUnreachable() implements RequestError {
    }

    /**
     * The request did not complete in time.
     */
    record TimedOut() implements RequestError {
    }

    /**
     * The request could not be built because its URL was malformed.
     */
    record BadUrl(String url) implements RequestError {
        public BadUrl {
            Objects.requireNonNull(url, "url must not be null");
        }
    }

    /**
     * The response arrived but its body could not be decoded.
     */
    record BadBody(String message) implements RequestError {
        public BadBody {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * A failure described only by a message.
     */
    record CustomError(String message) implements RequestError {
        public CustomError {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    static RequestError badStatus(int code) {
        return new BadStatus(code);
    }

    static RequestError networkUnreachable() {
        return new NetworkUnreachable();
    }

    static RequestError timedOut() {
        return new TimedOut();
    }

    static RequestError custom(String message) {
        return new CustomError(message);
    }

    /**
     * Returns the sentinel the retry engine uses internally when it must express a failure
     * of its own plumbing in {@link Result} shape. No classifier ever matches it and it is
     * never handed to calling code.
     *
     * <p>Engine-internal: public only so the {@code retry} and {@code classify} packages can
     * reach it. Application code has no use for it.
     */
    static RequestError placeholder() {
        return Placeholder.INSTANCE;
    }

    /**
     * Whether this is the engine's reserved sentinel.
     */
    default boolean isPlaceholder() {
        return this == Placeholder.INSTANCE;
    }
}
