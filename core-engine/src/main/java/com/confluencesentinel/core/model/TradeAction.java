package com.confluencesentinel.core.model;

/**
 * What happened to a position between two snapshots.
 *
 * @since 1.0.0
 */
public enum TradeAction {
    OPEN,
    INCREASE,
    DECREASE,
    CLOSE
}
