package org.javai.reattempt;

/**
 * Thrown when {@link Result#getOrThrow()} is called on a failed result.
 * Unchecked because it indicates misuse of the API: the caller should have checked
 * {@link Result#isFailed()} first.
 */
public class ResultFailedException extends RuntimeException {

    private final RequestError error;

    public ResultFailedException(RequestError error) {
        super("Result failed: " + error);
        this.error = error;
    }

    public RequestError error() {
        return error;
    }
}
