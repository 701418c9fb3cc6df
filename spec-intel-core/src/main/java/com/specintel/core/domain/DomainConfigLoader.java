package com.specintel.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.specintel.core.config.ConfigException;
import com.specintel.core.config.MalformedConfigException;
import com.specintel.core.config.StructuredDocuments;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import com.specintel.core.template.AnalyzerEngine;
import com.specintel.core.template.ExportEngine;
import com.specintel.core.template.QuestionEngine;
import com.specintel.core.template.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds a {@link Domain} from a domain document.
 *
 * <p>A domain document is a mapping with the header fields {@code domain_id}, {@code name},
 * {@code version}, {@code description} and {@code categories}, plus four sections
 * {@code questions}, {@code export_formats}, {@code conflict_rules} and
 * {@code quality_analyzers}. Each section is either an inline list or the name of a
 * per-kind document whose root is a list.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * domain_id: security
 * name: Security
 * version: 1.0.0
 * categories: [Authentication, Encryption]
 * questions: security-questions.yaml
 * conflict_rules:
 *   - rule_id: auth_conflict
 *     name: Authentication conflict
 *     condition: no two current specs in category 'Authentication' may disagree
 *     severity: error
 * }</pre>
 *
 * <p>All four sections are checked before anything is bound, so a broken document reports
 * every problem at once rather than the first one.
 */
public final class DomainConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DomainConfigLoader.class);

    private static final String QUESTIONS = "questions";
    private static final String EXPORT_FORMATS = "export_formats";
    private static final String CONFLICT_RULES = "conflict_rules";
    private static final String QUALITY_ANALYZERS = "quality_analyzers";

    private static final QuestionEngine QUESTION_ENGINE = new QuestionEngine();
    private static final ExportEngine EXPORT_ENGINE = new ExportEngine();
    private static final RuleEngine RULE_ENGINE = new RuleEngine();
    private static final AnalyzerEngine ANALYZER_ENGINE = new AnalyzerEngine();

    private DomainConfigLoader() {
        // Utility class
    }

    /**
     * Loads a domain document from the filesystem. Section documents resolve against
     * the domain document's directory.
     *
     * @param path domain document
     * @return built domain; not yet validated at domain level
     * @throws MalformedConfigException if a document cannot be read or has the wrong shape
     * @throws ConfigException listing every record issue across all sections
     */
    public static Domain load(Path path) {
        JsonNode root = StructuredDocuments.read(path);
        Path baseDir = path.toAbsolutePath().getParent();
        Domain domain = build(root, path, reference -> StructuredDocuments.read(baseDir.resolve(reference)));
        log.info("Loaded domain '{}' from {}", domain.domainId(), path);
        return domain;
    }

    /**
     * Loads a domain document from the classpath. Section documents resolve against the
     * domain resource's directory.
     *
     * @param resource classpath resource name, e.g. {@code domains/programming.yaml}
     * @return built domain
     * @throws MalformedConfigException if a resource is missing or has the wrong shape
     * @throws ConfigException listing every record issue across all sections
     */
    public static Domain fromClasspath(String resource) {
        ClassLoader loader = DomainConfigLoader.class.getClassLoader();
        int slash = resource.lastIndexOf('/');
        String baseDir = slash < 0 ? "" : resource.substring(0, slash + 1);
        Domain domain = build(readResource(loader, resource), Path.of(resource),
            reference -> readResource(loader, baseDir + reference));
        log.info("Loaded domain '{}' from classpath resource {}", domain.domainId(), resource);
        return domain;
    }

    // ==================== Internals ====================

    private static Domain build(JsonNode root, Path source, Function<String, JsonNode> documents) {
        if (!root.isObject()) {
            throw new MalformedConfigException("Domain document must contain a mapping at its root", source);
        }

        JsonNode questions = section(root, QUESTIONS, source, documents);
        JsonNode exportFormats = section(root, EXPORT_FORMATS, source, documents);
        JsonNode conflictRules = section(root, CONFLICT_RULES, source, documents);
        JsonNode analyzers = section(root, QUALITY_ANALYZERS, source, documents);

        List<ValidationIssue> issues = new ArrayList<>();
        issues.addAll(QUESTION_ENGINE.validateStructured(questions));
        issues.addAll(EXPORT_ENGINE.validateStructured(exportFormats));
        issues.addAll(RULE_ENGINE.validateStructured(conflictRules));
        issues.addAll(ANALYZER_ENGINE.validateStructured(analyzers));
        List<String> categories = categories(root, issues);
        if (!issues.isEmpty()) {
            throw new ConfigException("Invalid domain document", issues, source);
        }

        return Domain.builder(text(root, "domain_id"), text(root, "name"))
            .version(root.hasNonNull("version") ? root.get("version").asText() : "1.0.0")
            .description(text(root, "description"))
            .categories(categories)
            .questions(QUESTION_ENGINE.load(questions))
            .exportFormats(EXPORT_ENGINE.load(exportFormats))
            .conflictRules(RULE_ENGINE.load(conflictRules))
            .qualityAnalyzers(ANALYZER_ENGINE.load(analyzers))
            .build();
    }

    private static JsonNode section(JsonNode root, String name, Path source, Function<String, JsonNode> documents) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return StructuredDocuments.json().createArrayNode();
        }
        if (node.isTextual()) {
            log.debug("Reading section '{}' of {} from {}", name, source, node.asText());
            node = documents.apply(node.asText());
        }
        if (!node.isArray()) {
            throw new MalformedConfigException(
                "Section '" + name + "' must be a list or the name of a document containing a list", source);
        }
        return node;
    }

    private static List<String> categories(JsonNode root, List<ValidationIssue> issues) {
        JsonNode node = root.get("categories");
        if (node == null || node.isNull()) {
            return List.of();
        }
        String domainId = root.path("domain_id").asText("-");
        if (!node.isArray()) {
            issues.add(new ValidationIssue("domain", domainId, "categories", IssueType.INVALID_FORMAT,
                "field 'categories' must be a list of strings"));
            return List.of();
        }
        List<String> categories = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                issues.add(new ValidationIssue("domain", domainId, "categories", IssueType.INVALID_FORMAT,
                    "field 'categories' must be a list of strings"));
                return List.of();
            }
            categories.add(element.asText());
        }
        return categories;
    }

    private static String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() || !value.isValueNode() ? null : value.asText();
    }

    private static JsonNode readResource(ClassLoader loader, String resource) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new MalformedConfigException("Classpath resource not found", Path.of(resource));
            }
            return StructuredDocuments.read(in, resource);
        } catch (IOException e) {
            throw new MalformedConfigException("Failed to read classpath resource", Path.of(resource), e);
        }
    }
}
