package org.javai.reattempt;

/**
 * Holds the retry engine's sentinel error. Compared by identity: an equal
 * {@link RequestError.CustomError} built elsewhere is not the placeholder.
 */
final class Placeholder {

    static final RequestError.CustomError INSTANCE = new RequestError.CustomError("reattempt:internal-placeholder");

    private Placeholder() {
        // Holder class
    }
}
