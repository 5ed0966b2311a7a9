package com.confluencesentinel.core.diff;

/**
 * Signals a broken internal invariant, i.e. a programming error rather than bad
 * input. Callers must not treat it as a recoverable runtime condition.
 *
 * @since 1.0.0
 */
public class InvariantViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvariantViolationException(String message) {
        super(message);
    }
}
