/**
 * Sliding-window confluence detection per scope key.
 *
 * <p>
 * {@link com.confluencesentinel.core.detection.EventWindowStore} holds the
 * windows; {@link com.confluencesentinel.core.detection.CorrelationDetector}
 * applies the threshold and cooldown rules on top of it. One detector exists
 * per {@link com.confluencesentinel.core.model.ScopeType}.
 * </p>
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.detection;
