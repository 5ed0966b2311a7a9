package com.confluencesentinel.core.config;

/**
 * Thrown by a {@link RuleStore} when rules cannot be read or written.
 *
 * @since 1.0.0
 */
public class RuleStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RuleStoreException(String message) {
        super(message);
    }

    public RuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
