package com.confluencesentinel.core.poller;

/**
 * Lifecycle of a {@link PollerCoordinator}.
 *
 * <pre>
 * IDLE --start--&gt; RUNNING --stop--&gt; STOPPING --&gt; IDLE
 *                  RUNNING --invariant violation--&gt; FAILED
 * </pre>
 *
 * @since 1.0.0
 */
public enum PollerState {
    IDLE,
    RUNNING,
    STOPPING,
    FAILED
}
