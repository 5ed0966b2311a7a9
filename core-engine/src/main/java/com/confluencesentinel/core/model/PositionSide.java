package com.confluencesentinel.core.model;

import java.math.BigDecimal;

/**
 * Direction of a position.
 *
 * @since 1.0.0
 */
public enum PositionSide {
    LONG,
    SHORT;

    /**
     * @param signedSize non-zero signed size
     * @return {@link #SHORT} for negative sizes, {@link #LONG} otherwise
     */
    public static PositionSide of(BigDecimal signedSize) {
        return signedSize.signum() < 0 ? SHORT : LONG;
    }
}
