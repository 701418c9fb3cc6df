package com.specintel.core;

/**
 * Root of every error raised by the specification intelligence engine.
 *
 * <p>All engine errors are unchecked. Subclasses identify the construct at fault
 * (domain ID, rule ID, specification key) so callers never have to parse messages.
 */
public class SpecIntelException extends RuntimeException {

    public SpecIntelException(String message) {
        super(message);
    }

    public SpecIntelException(String message, Throwable cause) {
        super(message, cause);
    }
}
