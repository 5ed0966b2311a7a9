/**
 * Domain model for Confluence Sentinel.
 *
 * <p>
 * Everything in this package is immutable once built:
 * </p>
 * <ul>
 * <li>{@link com.confluencesentinel.core.model.TrackedAccount}: watched
 * exchange account</li>
 * <li>{@link com.confluencesentinel.core.model.PositionSnapshot} and
 * {@link com.confluencesentinel.core.model.Position}: what a snapshot source
 * returns</li>
 * <li>{@link com.confluencesentinel.core.model.TradeEvent}: a position change
 * found by the differ</li>
 * <li>{@link com.confluencesentinel.core.model.WindowEntry}: an event inside a
 * correlation window</li>
 * <li>{@link com.confluencesentinel.core.model.CorrelationGroup}: a detected
 * confluence</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.model;
