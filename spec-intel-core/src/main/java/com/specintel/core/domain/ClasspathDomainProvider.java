package com.specintel.core.domain;

import java.util.Objects;

/**
 * Base class for providers whose domain is a document shipped on the classpath.
 */
public abstract class ClasspathDomainProvider implements DomainProvider {

    private final String domainId;
    private final String resource;

    protected ClasspathDomainProvider(String domainId, String resource) {
        this.domainId = Objects.requireNonNull(domainId, "domainId must not be null");
        this.resource = Objects.requireNonNull(resource, "resource must not be null");
    }

    @Override
    public String domainId() {
        return domainId;
    }

    /**
     * @return classpath resource holding the domain document
     */
    public String resource() {
        return resource;
    }

    @Override
    public Domain create() {
        return DomainConfigLoader.fromClasspath(resource);
    }
}
