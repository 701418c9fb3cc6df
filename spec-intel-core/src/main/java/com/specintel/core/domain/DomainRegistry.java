package com.specintel.core.domain;

import com.specintel.core.NotFoundException;
import com.specintel.core.config.ConfigException;
import com.specintel.core.config.ConfigLoader;
import com.specintel.core.config.EngineConfig;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Directory of domains keyed by domain ID.
 *
 * <p>Domains are registered as constructors and built lazily. The first {@link #get(String)}
 * for an ID builds and validates the domain; if that succeeds the instance is cached and
 * every later lookup returns the same object. A domain that fails validation is never
 * cached, so a retry after fixing its configuration can succeed.
 *
 * <p>Concurrent lookups of the same ID build the domain exactly once: the construction
 * runs inside {@link ConcurrentHashMap#computeIfAbsent}, which blocks other callers for that
 * key until it completes.
 *
 * <p>Consumers normally receive a registry by constructor injection. {@link #shared()}
 * returns a process-wide instance populated with every {@link DomainProvider} on the classpath.
 */
public class DomainRegistry {

    private static final Logger log = LoggerFactory.getLogger(DomainRegistry.class);

    private final Map<String, Supplier<Domain>> constructors = new ConcurrentHashMap<>();
    private final Map<String, Domain> domains = new ConcurrentHashMap<>();

    /**
     * @return process-wide registry holding all discovered providers
     */
    public static DomainRegistry shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * Creates a registry holding every {@link DomainProvider} found by {@link ServiceLoader}.
     *
     * @return new registry
     */
    public static DomainRegistry discover() {
        DomainRegistry registry = new DomainRegistry();
        registry.registerProviders(ServiceLoader.load(DomainProvider.class));
        return registry;
    }

    // ==================== Registration ====================

    /**
     * Registers a domain constructor.
     *
     * @param domainId domain ID
     * @param constructor builds the domain on first lookup
     * @throws DuplicateDomainException if the ID is already registered
     */
    public void register(String domainId, Supplier<Domain> constructor) {
        Objects.requireNonNull(domainId, "domainId must not be null");
        Objects.requireNonNull(constructor, "constructor must not be null");
        if (constructors.putIfAbsent(domainId, constructor) != null) {
            throw new DuplicateDomainException(domainId);
        }
        log.info("Registered domain: {}", domainId);
    }

    public void register(DomainProvider provider) {
        register(provider.domainId(), provider::create);
    }

    public void registerProviders(Iterable<? extends DomainProvider> providers) {
        for (DomainProvider provider : providers) {
            register(provider);
        }
    }

    /**
     * Registers the domain documents listed in an engine configuration.
     *
     * @param config engine configuration
     * @param configPath file the configuration was loaded from; relative paths resolve against it
     * @throws DuplicateDomainException if a configured ID is already registered
     */
    public void registerConfigured(EngineConfig config, Path configPath) {
        ConfigLoader.domainDocuments(config, configPath)
            .forEach((domainId, document) -> register(domainId, () -> DomainConfigLoader.load(document)));
    }

    /**
     * Removes a registration and any cached instance.
     *
     * @param domainId domain ID
     * @return true if the ID was registered
     */
    public boolean unregister(String domainId) {
        domains.remove(domainId);
        boolean removed = constructors.remove(domainId) != null;
        if (removed) {
            log.info("Unregistered domain: {}", domainId);
        }
        return removed;
    }

    public void clear() {
        domains.clear();
        constructors.clear();
        log.debug("Cleared all domain registrations");
    }

    // ==================== Lookup ====================

    /**
     * Returns the domain, building and validating it on first use.
     *
     * @param domainId domain ID
     * @return cached domain
     * @throws NotFoundException if the ID is not registered
     * @throws DomainConfigException listing every issue if the domain is invalid
     */
    public Domain get(String domainId) {
        Domain cached = domains.get(domainId);
        if (cached != null) {
            return cached;
        }
        Supplier<Domain> constructor = constructors.get(domainId);
        if (constructor == null) {
            throw new NotFoundException("domain", domainId);
        }
        return domains.computeIfAbsent(domainId, id -> construct(id, constructor));
    }

    /**
     * @param domainId domain ID
     * @return true if registered, whether or not it has been built yet
     */
    public boolean has(String domainId) {
        return constructors.containsKey(domainId);
    }

    /**
     * @return registered IDs in alphabetical order
     */
    public List<String> listIds() {
        return constructors.keySet().stream().sorted().toList();
    }

    /**
     * Summarizes every registered domain, building any that have not been built yet.
     *
     * @return one summary per domain, ordered by ID
     * @throws DomainConfigException if any domain is invalid
     */
    public List<DomainSummary> summaries() {
        return listIds().stream()
            .map(id -> get(id).summary())
            .toList();
    }

    // ==================== Internals ====================

    private Domain construct(String domainId, Supplier<Domain> constructor) {
        log.debug("Building domain: {}", domainId);
        Domain domain;
        try {
            domain = constructor.get();
        } catch (ConfigException e) {
            List<ValidationIssue> issues = new ArrayList<>(e.issues());
            if (issues.isEmpty()) {
                issues.add(new ValidationIssue("domain", domainId, null, IssueType.INVALID_FORMAT, e.getMessage()));
            }
            DomainConfigException failure = new DomainConfigException(domainId, issues);
            failure.initCause(e);
            log.warn("Domain '{}' failed to load: {}", domainId, e.getMessage());
            throw failure;
        }
        if (domain == null) {
            throw new DomainConfigException(domainId, List.of(new ValidationIssue("domain", domainId, null,
                IssueType.MISSING_FIELD, "constructor returned no domain")));
        }

        List<ValidationIssue> issues = new ArrayList<>();
        if (domain.domainId() != null && !domain.domainId().isBlank() && !domainId.equals(domain.domainId())) {
            issues.add(new ValidationIssue("domain", domainId, "domain_id", IssueType.ILLEGAL_VALUE,
                "domain declares id '" + domain.domainId() + "' but is registered as '" + domainId + "'"));
        }
        issues.addAll(domain.validate());
        if (!issues.isEmpty()) {
            log.warn("Domain '{}' failed validation with {} issue(s)", domainId, issues.size());
            throw new DomainConfigException(domainId, issues);
        }

        log.info("Built domain '{}' version {}: {} question(s), {} rule(s), {} analyzer(s)",
            domainId, domain.version(), domain.questions().size(), domain.conflictRules().size(),
            domain.qualityAnalyzers().size());
        return domain;
    }

    private static final class SharedHolder {
        private static final DomainRegistry INSTANCE = discover();
    }
}
