package com.specintel.core.domain;

/**
 * Service Provider Interface for built-in and third-party domains.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.specintel.core.domain.DomainProvider} and registered with
 * {@link DomainRegistry#discover()}. Providers must have a public no-arg constructor and
 * must not do any work until {@link #create()} is called.
 *
 * @see ClasspathDomainProvider
 */
public interface DomainProvider {

    /**
     * @return ID the domain is registered under, e.g. {@code "programming"}
     */
    String domainId();

    /**
     * Builds the domain. Called at most once per successful registry lookup.
     *
     * @return newly built domain
     * @throws com.specintel.core.config.ConfigException if the domain's configuration is invalid
     */
    Domain create();
}
