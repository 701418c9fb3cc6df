package com.specintel.core.domain;

import com.specintel.core.config.ConfigException;
import com.specintel.core.model.ValidationIssue;

import java.util.List;

/**
 * Raised when a domain cannot be constructed because its configuration is invalid.
 *
 * <p>Lists every issue found across the domain header and its four record sets.
 */
public class DomainConfigException extends ConfigException {

    private final String domainId;

    public DomainConfigException(String domainId, List<ValidationIssue> issues) {
        super("Domain '" + domainId + "' has invalid configuration", issues);
        this.domainId = domainId;
    }

    public String domainId() {
        return domainId;
    }
}
