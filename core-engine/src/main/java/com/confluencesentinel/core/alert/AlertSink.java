package com.confluencesentinel.core.alert;

/**
 * Destination of formatted alerts (chat channel, message topic, log).
 *
 * <p>
 * Implementations handle their own transient retries. An exception thrown
 * from {@link #deliver} is final for that payload.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertSink extends AutoCloseable {

    /**
     * @throws AlertDeliveryException if the payload could not be delivered
     */
    void deliver(AlertPayload payload) throws AlertDeliveryException;

    /**
     * Releases the sink's resources. No-op by default.
     */
    @Override
    default void close() {
    }
}
