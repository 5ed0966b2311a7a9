package com.confluencesentinel.core.diff;

/**
 * Thrown when a snapshot cannot be trusted for diffing (missing instrument id,
 * missing size or value, duplicated instrument, unparseable number).
 *
 * <p>
 * The poller logs it and keeps the previous baseline, so the next good
 * snapshot is diffed against the last known good state.
 * </p>
 *
 * @since 1.0.0
 */
public class MalformedSnapshotException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String accountId;

    public MalformedSnapshotException(String accountId, String message) {
        super(message);
        this.accountId = accountId;
    }

    public MalformedSnapshotException(String accountId, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
