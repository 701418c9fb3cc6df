package com.specintel.core.domain;

/**
 * Software development domain: architecture, APIs, data, testing, performance and operations.
 */
public class ProgrammingDomainProvider extends ClasspathDomainProvider {

    public ProgrammingDomainProvider() {
        super("programming", "domains/programming.yaml");
    }
}
