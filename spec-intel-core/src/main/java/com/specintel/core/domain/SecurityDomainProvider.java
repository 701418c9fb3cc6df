package com.specintel.core.domain;

/**
 * Application security domain: authentication, authorization, encryption and compliance.
 */
public class SecurityDomainProvider extends ClasspathDomainProvider {

    public SecurityDomainProvider() {
        super("security", "domains/security.yaml");
    }
}
