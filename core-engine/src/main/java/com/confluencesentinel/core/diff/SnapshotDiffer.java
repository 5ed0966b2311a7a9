package com.confluencesentinel.core.diff;

import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.model.TradeEvent;

import java.util.List;

/**
 * Turns two consecutive position snapshots of one account into trade events.
 *
 * <p>
 * Implementations must emit at most one event per instrument per call and
 * must emit nothing when there is no previous snapshot.
 * </p>
 */
public interface SnapshotDiffer {

    /**
     * @param accountId account both snapshots belong to
     * @param previous  baseline snapshot, or {@code null} on first observation
     * @param current   newly fetched snapshot
     * @return trade events in deterministic order; empty if nothing changed
     * @throws InvariantViolationException if the implementation produced two
     *                                     events for the same instrument
     */
    List<TradeEvent> diff(String accountId, PositionSnapshot previous, PositionSnapshot current);
}
