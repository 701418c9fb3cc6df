package com.specintel.core.domain;

import com.specintel.core.NotFoundException;
import com.specintel.core.config.ConfigLoader;
import com.specintel.core.config.MalformedConfigException;
import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.QualityAnalyzer;
import com.specintel.core.model.Severity;
import com.specintel.core.model.ValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link DomainRegistry}.
 */
class DomainRegistryTest {

    private DomainRegistry registry;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        registry = new DomainRegistry();
    }

    private static Domain validDomain(String id) {
        return Domain.builder(id, "Domain " + id)
            .categories(List.of("Performance", "Security"))
            .conflictRules(List.of(new ConflictRule("perf_conflict", "Performance", null,
                "no two current specs in category 'Performance' may set contradictory numeric targets",
                Severity.ERROR, null)))
            .build();
    }

    private static Domain invalidDomain(String id) {
        return Domain.builder(id, "Broken " + id)
            .categories(List.of("Performance", "performance"))
            .conflictRules(List.of(
                new ConflictRule("dup", "One", null, "c", Severity.ERROR, null),
                new ConflictRule("dup", "Two", null, "c", Severity.INFO, null)))
            .qualityAnalyzers(List.of(new QualityAnalyzer("a1", "", null, "bias", true, false, List.of())))
            .build();
    }

    // ==================== Lookup ====================

    @Test
    void get_calledTwice_returnsSameInstance() {
        AtomicInteger constructions = new AtomicInteger();
        registry.register("x", () -> {
            constructions.incrementAndGet();
            return validDomain("x");
        });

        Domain first = registry.get("x");
        Domain second = registry.get("x");

        assertThat(second).isSameAs(first);
        assertThat(constructions).hasValue(1);
    }

    @Test
    void get_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> registry.get("missing"))
            .isInstanceOfSatisfying(NotFoundException.class, e -> {
                assertThat(e.subject()).isEqualTo("domain");
                assertThat(e.identifier()).isEqualTo("missing");
            });
    }

    @Test
    void get_invalidDomain_listsEveryIssue() {
        registry.register("broken", () -> invalidDomain("broken"));

        assertThatThrownBy(() -> registry.get("broken"))
            .isInstanceOfSatisfying(DomainConfigException.class, e -> {
                assertThat(e.domainId()).isEqualTo("broken");
                assertThat(e.issues())
                    .extracting(ValidationIssue::field)
                    .containsExactlyInAnyOrder("categories", "rule_id", "name");
            });
    }

    @Test
    void get_failedConstruction_isNotCachedAndRetrySucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        registry.register("flaky", () -> attempts.incrementAndGet() == 1 ? invalidDomain("flaky") : validDomain("flaky"));

        assertThatThrownBy(() -> registry.get("flaky")).isInstanceOf(DomainConfigException.class);
        Domain domain = registry.get("flaky");

        assertThat(domain.name()).isEqualTo("Domain flaky");
        assertThat(registry.get("flaky")).isSameAs(domain);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void get_malformedDocument_wrapsAsDomainConfigException() {
        registry.register("doc", () -> DomainConfigLoader.load(tempDir.resolve("absent.yaml")));

        assertThatThrownBy(() -> registry.get("doc"))
            .isInstanceOf(DomainConfigException.class)
            .hasCauseInstanceOf(MalformedConfigException.class)
            .satisfies(e -> assertThat(((DomainConfigException) e).issues()).hasSize(1));
    }

    @Test
    void get_declaredIdDiffersFromRegisteredId_fails() {
        registry.register("alias", () -> validDomain("original"));

        assertThatThrownBy(() -> registry.get("alias"))
            .isInstanceOf(DomainConfigException.class)
            .hasMessageContaining("original");
    }

    @Test
    void get_concurrentCallers_constructExactlyOnce() throws Exception {
        AtomicInteger constructions = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        registry.register("shared", () -> {
            constructions.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return validDomain("shared");
        });

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Domain>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.get("shared");
                }));
            }
            start.countDown();

            Domain first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Domain> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(constructions).hasValue(1);
    }

    // ==================== Registration ====================

    @Test
    void register_sameIdTwice_throwsDuplicate() {
        registry.register("x", () -> validDomain("x"));

        assertThatThrownBy(() -> registry.register("x", () -> validDomain("x")))
            .isInstanceOfSatisfying(DuplicateDomainException.class,
                e -> assertThat(e.domainId()).isEqualTo("x"));
    }

    @Test
    void hasAndListIds_doNotConstruct() {
        AtomicInteger constructions = new AtomicInteger();
        Supplier<Domain> constructor = () -> {
            constructions.incrementAndGet();
            return validDomain("b");
        };
        registry.register("b", constructor);
        registry.register("a", () -> validDomain("a"));

        assertThat(registry.has("b")).isTrue();
        assertThat(registry.has("c")).isFalse();
        assertThat(registry.listIds()).containsExactly("a", "b");
        assertThat(constructions).hasValue(0);
    }

    @Test
    void unregister_removesRegistrationAndCachedInstance() {
        registry.register("x", () -> validDomain("x"));
        Domain before = registry.get("x");

        assertThat(registry.unregister("x")).isTrue();
        assertThat(registry.unregister("x")).isFalse();
        assertThatThrownBy(() -> registry.get("x")).isInstanceOf(NotFoundException.class);

        registry.register("x", () -> validDomain("x"));
        assertThat(registry.get("x")).isNotSameAs(before);
    }

    @Test
    void clear_removesEverything() {
        registry.register("x", () -> validDomain("x"));
        registry.get("x");

        registry.clear();

        assertThat(registry.listIds()).isEmpty();
    }

    @Test
    void summaries_buildsEachDomain() {
        registry.register("a", () -> validDomain("a"));
        registry.register("b", () -> validDomain("b"));

        assertThat(registry.summaries())
            .extracting(DomainSummary::domainId, DomainSummary::categoryCount, DomainSummary::conflictRuleCount)
            .containsExactly(
                tuple("a", 2, 1),
                tuple("b", 2, 1));
    }

    @Test
    void registerConfigured_registersDocumentsLazily() throws IOException {
        Path configFile = tempDir.resolve("specintel.yaml");
        Files.writeString(configFile, """
            domains:
              - id: fintech
                path: fintech.yaml
            """);
        Files.writeString(tempDir.resolve("fintech.yaml"), """
            domain_id: fintech
            name: Financial Technology
            categories: [Compliance]
            """);

        registry.registerConfigured(ConfigLoader.load(configFile), configFile);

        assertThat(registry.has("fintech")).isTrue();
        assertThat(registry.get("fintech").categories()).containsExactly("Compliance");
    }
}
