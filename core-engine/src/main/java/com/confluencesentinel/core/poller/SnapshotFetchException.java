package com.confluencesentinel.core.poller;

/**
 * Thrown when a snapshot could not be obtained from the exchange.
 *
 * <p>
 * {@link #isTransient()} tells retrying decorators whether another attempt
 * can succeed (timeouts, 5xx, connection resets) or not (4xx).
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final boolean transientFailure;

    public SnapshotFetchException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public SnapshotFetchException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
