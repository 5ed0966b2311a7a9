package com.confluencesentinel.core.config;

/**
 * Thrown when a rule value fails validation at the write boundary.
 *
 * <p>
 * The registry guarantees that the previously committed rules are still in
 * force when this exception is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidRuleException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
