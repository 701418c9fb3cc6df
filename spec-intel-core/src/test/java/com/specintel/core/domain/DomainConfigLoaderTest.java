package com.specintel.core.domain;

import com.specintel.core.config.ConfigException;
import com.specintel.core.config.MalformedConfigException;
import com.specintel.core.model.ValidationIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link DomainConfigLoader}.
 */
class DomainConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_inlineSections_buildsDomain() throws IOException {
        Path document = tempDir.resolve("fintech.yaml");
        Files.writeString(document, """
            domain_id: fintech
            name: Financial Technology
            version: 2.1.0
            description: Payments and ledgers
            categories: [Compliance, Performance]
            questions:
              - question_id: comp_1
                category: Compliance
                text: Which regulations apply?
            conflict_rules:
              - rule_id: perf_latency
                name: Latency
                condition: no two current specs in category 'Performance' may set contradictory numeric targets
                severity: error
            quality_analyzers:
              - analyzer_id: pci_checker
                name: PCI Checker
                analyzer_type: compliance
                required: true
            """);

        Domain domain = DomainConfigLoader.load(document);

        assertThat(domain.domainId()).isEqualTo("fintech");
        assertThat(domain.version()).isEqualTo("2.1.0");
        assertThat(domain.description()).isEqualTo("Payments and ledgers");
        assertThat(domain.categories()).containsExactly("Compliance", "Performance");
        assertThat(domain.questions()).hasSize(1);
        assertThat(domain.exportFormats()).isEmpty();
        assertThat(domain.conflictRules()).hasSize(1);
        assertThat(domain.qualityAnalyzers()).singleElement()
            .satisfies(analyzer -> assertThat(analyzer.required()).isTrue());
        assertThat(domain.validate()).isEmpty();
    }

    @Test
    void load_sectionReference_readsSiblingDocument() throws IOException {
        Files.createDirectories(tempDir.resolve("fintech"));
        Files.writeString(tempDir.resolve("fintech/exporters.json"), """
            [{"format_id": "ledger_csv", "name": "Ledger CSV", "file_extension": ".csv",
              "mime_type": "text/csv", "template_id": "ledger"}]
            """);
        Path document = tempDir.resolve("fintech.yaml");
        Files.writeString(document, """
            domain_id: fintech
            name: Financial Technology
            export_formats: fintech/exporters.json
            """);

        Domain domain = DomainConfigLoader.load(document);

        assertThat(domain.exportFormat("ledger_csv")).isPresent();
    }

    @Test
    void load_problemsInSeveralSections_reportsAllOfThem() throws IOException {
        Path document = tempDir.resolve("broken.yaml");
        Files.writeString(document, """
            domain_id: broken
            name: Broken
            export_formats:
              - format_id: pdf
                name: PDF
                file_extension: pdf
                mime_type: application/pdf
                template_id: pdf
            conflict_rules:
              - rule_id: r1
                name: Rule
                condition: anything
                severity: critical
              - rule_id: r1
                name: Rule again
                condition: anything
                severity: info
            """);

        assertThatThrownBy(() -> DomainConfigLoader.load(document))
            .isInstanceOfSatisfying(ConfigException.class, e -> {
                assertThat(e).isNotInstanceOf(MalformedConfigException.class);
                assertThat(e.issues())
                    .extracting(ValidationIssue::kind, ValidationIssue::field)
                    .containsExactlyInAnyOrder(
                        tuple("export format", "file_extension"),
                        tuple("conflict rule", "severity"),
                        tuple("conflict rule", "rule_id"));
            });
    }

    @Test
    void load_listRoot_throwsMalformed() throws IOException {
        Path document = tempDir.resolve("list.yaml");
        Files.writeString(document, "- domain_id: x\n");

        assertThatThrownBy(() -> DomainConfigLoader.load(document))
            .isInstanceOf(MalformedConfigException.class)
            .hasMessageContaining("mapping");
    }

    @Test
    void load_sectionIsMapping_throwsMalformed() throws IOException {
        Path document = tempDir.resolve("odd.yaml");
        Files.writeString(document, """
            domain_id: odd
            name: Odd
            questions:
              question_id: q1
            """);

        assertThatThrownBy(() -> DomainConfigLoader.load(document))
            .isInstanceOf(MalformedConfigException.class)
            .hasMessageContaining("questions");
    }

    @Test
    void load_missingSectionDocument_throwsMalformed() throws IOException {
        Path document = tempDir.resolve("dangling.yaml");
        Files.writeString(document, """
            domain_id: dangling
            name: Dangling
            questions: nowhere.yaml
            """);

        assertThatThrownBy(() -> DomainConfigLoader.load(document))
            .isInstanceOf(MalformedConfigException.class);
    }

    @Test
    void load_categoriesNotAList_reportsIssue() throws IOException {
        Path document = tempDir.resolve("cats.yaml");
        Files.writeString(document, """
            domain_id: cats
            name: Cats
            categories: Performance
            """);

        assertThatThrownBy(() -> DomainConfigLoader.load(document))
            .isInstanceOfSatisfying(ConfigException.class, e -> assertThat(e.issues())
                .extracting(ValidationIssue::field)
                .containsExactly("categories"));
    }

    @Test
    void fromClasspath_programming_loadsBuiltInDomain() {
        Domain domain = DomainConfigLoader.fromClasspath("domains/programming.yaml");

        assertThat(domain.domainId()).isEqualTo("programming");
        assertThat(domain.categories()).hasSize(7);
        assertThat(domain.questions()).hasSize(14);
        assertThat(domain.exportFormats()).hasSize(8);
        assertThat(domain.conflictRules()).hasSize(4);
        assertThat(domain.qualityAnalyzerIds())
            .containsExactly("bias_detector", "performance_validator", "security_validator", "scalability_checker");
        assertThat(domain.validate()).isEmpty();
    }

    @Test
    void fromClasspath_security_resolvesSectionResources() {
        Domain domain = DomainConfigLoader.fromClasspath("domains/security.yaml");

        assertThat(domain.questions()).hasSize(7);
        assertThat(domain.exportFormats()).hasSize(3);
        assertThat(domain.conflictRules()).hasSize(3);
        assertThat(domain.enabledAnalyzers()).hasSize(2);
        assertThat(domain.validate()).isEmpty();
    }

    @Test
    void fromClasspath_missingResource_throwsMalformed() {
        assertThatThrownBy(() -> DomainConfigLoader.fromClasspath("domains/absent.yaml"))
            .isInstanceOf(MalformedConfigException.class)
            .hasMessageContaining("not found");
    }
}
