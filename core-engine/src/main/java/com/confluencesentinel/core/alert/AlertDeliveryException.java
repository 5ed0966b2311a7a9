package com.confluencesentinel.core.alert;

/**
 * Thrown by an {@link AlertSink} when a payload could not be delivered.
 *
 * @since 1.0.0
 */
public class AlertDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
