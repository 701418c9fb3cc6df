package com.specintel.core;

/**
 * Raised when a lookup by identifier finds nothing.
 *
 * <p>Used for domains, specifications and conflicts alike; {@link #subject()} tells which.
 */
public class NotFoundException extends SpecIntelException {

    private final String subject;
    private final String identifier;

    public NotFoundException(String subject, String identifier) {
        super(subject + " not found: " + identifier);
        this.subject = subject;
        this.identifier = identifier;
    }

    public NotFoundException(String subject, String identifier, String detail) {
        super(subject + " not found: " + identifier + ". " + detail);
        this.subject = subject;
        this.identifier = identifier;
    }

    /**
     * @return kind of thing that was looked up, e.g. "domain" or "specification"
     */
    public String subject() {
        return subject;
    }

    /**
     * @return identifier that was not found
     */
    public String identifier() {
        return identifier;
    }
}
