package com.confluencesentinel.core.poller;

import com.confluencesentinel.core.model.PositionSnapshot;

/**
 * Supplies the current positions of an account.
 *
 * <p>
 * Implementations may throw
 * {@link com.confluencesentinel.core.diff.MalformedSnapshotException} when
 * the response cannot be interpreted; everything else is reported as a
 * {@link SnapshotFetchException}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SnapshotSource {

    /**
     * @param accountId normalised account address
     * @return the account's current positions
     * @throws SnapshotFetchException if the snapshot could not be obtained
     */
    PositionSnapshot fetchSnapshot(String accountId) throws SnapshotFetchException;
}
