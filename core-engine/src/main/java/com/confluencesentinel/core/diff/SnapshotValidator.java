package com.confluencesentinel.core.diff;

import com.confluencesentinel.core.model.Position;
import com.confluencesentinel.core.model.PositionSnapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks applied to every snapshot before it is diffed.
 *
 * @since 1.0.0
 */
public final class SnapshotValidator {

    private SnapshotValidator() {
    }

    /**
     * @param expectedAccountId account the snapshot was requested for
     * @param snapshot          snapshot to check
     * @throws MalformedSnapshotException listing every problem found
     */
    public static void validate(String expectedAccountId, PositionSnapshot snapshot) {
        if (snapshot == null) {
            throw new MalformedSnapshotException(expectedAccountId, "Snapshot is null");
        }
        List<String> errors = new ArrayList<>();
        if (!snapshot.getAccountId().equalsIgnoreCase(expectedAccountId)) {
            errors.add("snapshot belongs to " + snapshot.getAccountId());
        }
        Set<String> seen = new HashSet<>();
        List<Position> positions = snapshot.getPositions();
        for (int i = 0; i < positions.size(); i++) {
            Position p = positions.get(i);
            if (p == null) {
                errors.add("position #" + i + " is null");
                continue;
            }
            if (p.getInstrumentId() == null || p.getInstrumentId().isBlank()) {
                errors.add("position #" + i + " has no instrument id");
                continue;
            }
            if (p.getSize() == null) {
                errors.add(p.getInstrumentId() + " has no size");
            }
            if (p.getNotionalValue() == null) {
                errors.add(p.getInstrumentId() + " has no notional value");
            } else if (p.getNotionalValue().signum() < 0) {
                errors.add(p.getInstrumentId() + " has a negative notional value");
            }
            if (!seen.add(p.getInstrumentId())) {
                errors.add(p.getInstrumentId() + " appears more than once");
            }
        }
        if (!errors.isEmpty()) {
            throw new MalformedSnapshotException(expectedAccountId,
                    "Malformed snapshot for " + expectedAccountId + ": " + String.join("; ", errors));
        }
    }
}
