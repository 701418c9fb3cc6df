package com.specintel.core.domain;

import com.specintel.core.SpecIntelException;

/**
 * Raised when a domain ID is registered twice.
 */
public class DuplicateDomainException extends SpecIntelException {

    private final String domainId;

    public DuplicateDomainException(String domainId) {
        super("Domain already registered: " + domainId);
        this.domainId = domainId;
    }

    public String domainId() {
        return domainId;
    }
}
