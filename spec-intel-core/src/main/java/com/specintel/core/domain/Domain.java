package com.specintel.core.domain;

import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.ExportFormat;
import com.specintel.core.model.QualityAnalyzer;
import com.specintel.core.model.Question;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import com.specintel.core.template.AnalyzerEngine;
import com.specintel.core.template.ExportEngine;
import com.specintel.core.template.QuestionEngine;
import com.specintel.core.template.RuleEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A named, versioned bundle of categories, questions, export formats, conflict rules and
 * quality analyzer declarations for one knowledge area.
 *
 * <p>Immutable once built. A configuration change means building a new {@code Domain}
 * and registering it under a fresh registry entry. Null entries in the lists are kept so
 * {@link #validate()} can report them.
 *
 * <pre>{@code
 * Domain domain = Domain.builder("programming", "Programming")
 *     .version("1.0.0")
 *     .categories(List.of("Architecture", "Testing"))
 *     .questions(questions)
 *     .conflictRules(rules)
 *     .build();
 * }</pre>
 */
public final class Domain {

    private static final QuestionEngine QUESTIONS = new QuestionEngine();
    private static final ExportEngine EXPORTS = new ExportEngine();
    private static final RuleEngine RULES = new RuleEngine();
    private static final AnalyzerEngine ANALYZERS = new AnalyzerEngine();

    private final String domainId;
    private final String name;
    private final String version;
    private final String description;
    private final List<String> categories;
    private final List<Question> questions;
    private final List<ExportFormat> exportFormats;
    private final List<ConflictRule> conflictRules;
    private final List<QualityAnalyzer> qualityAnalyzers;

    private Domain(Builder builder) {
        this.domainId = builder.domainId;
        this.name = builder.name;
        this.version = builder.version;
        this.description = builder.description;
        this.categories = Collections.unmodifiableList(new ArrayList<>(builder.categories));
        this.questions = Collections.unmodifiableList(new ArrayList<>(builder.questions));
        this.exportFormats = Collections.unmodifiableList(new ArrayList<>(builder.exportFormats));
        this.conflictRules = Collections.unmodifiableList(new ArrayList<>(builder.conflictRules));
        this.qualityAnalyzers = Collections.unmodifiableList(new ArrayList<>(builder.qualityAnalyzers));
    }

    public static Builder builder(String domainId, String name) {
        return new Builder(domainId, name);
    }

    public String domainId() {
        return domainId;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public String description() {
        return description;
    }

    public List<String> categories() {
        return categories;
    }

    public List<Question> questions() {
        return questions;
    }

    public List<ExportFormat> exportFormats() {
        return exportFormats;
    }

    public List<ConflictRule> conflictRules() {
        return conflictRules;
    }

    public List<QualityAnalyzer> qualityAnalyzers() {
        return qualityAnalyzers;
    }

    // ==================== Lookups ====================

    public List<Question> questionsByCategory(String category) {
        return QUESTIONS.filterByCategory(questions, category);
    }

    public Optional<ExportFormat> exportFormat(String formatId) {
        return EXPORTS.find(exportFormats, formatId);
    }

    public List<QualityAnalyzer> enabledAnalyzers() {
        return ANALYZERS.enabled(qualityAnalyzers);
    }

    /**
     * @return IDs of every declared analyzer, enabled or not, in declaration order
     */
    public List<String> qualityAnalyzerIds() {
        return qualityAnalyzers.stream().map(QualityAnalyzer::analyzerId).toList();
    }

    public DomainSummary summary() {
        return new DomainSummary(domainId, name, version, categories.size(), questions.size(),
            exportFormats.size(), conflictRules.size(), qualityAnalyzers.size());
    }

    // ==================== Validation ====================

    /**
     * Validates the domain and all four record sets.
     *
     * @return every issue found, empty if the domain is usable
     */
    public List<ValidationIssue> validate() {
        List<ValidationIssue> issues = new ArrayList<>();
        String subject = domainId == null || domainId.isBlank() ? "-" : domainId;
        if (domainId == null || domainId.isBlank()) {
            issues.add(new ValidationIssue("domain", subject, "domain_id", IssueType.MISSING_FIELD,
                "required field 'domain_id' is missing or blank"));
        }
        if (name == null || name.isBlank()) {
            issues.add(new ValidationIssue("domain", subject, "name", IssueType.MISSING_FIELD,
                "required field 'name' is missing or blank"));
        }
        Set<String> seen = new HashSet<>();
        for (String category : categories) {
            if (category == null || category.isBlank()) {
                issues.add(new ValidationIssue("domain", subject, "categories", IssueType.ILLEGAL_VALUE,
                    "categories must not contain null or blank entries"));
            } else if (!seen.add(category.trim().toLowerCase(Locale.ROOT))) {
                issues.add(new ValidationIssue("domain", subject, "categories", IssueType.DUPLICATE_ID,
                    "duplicate category '" + category + "'"));
            }
        }
        issues.addAll(QUESTIONS.validate(questions));
        issues.addAll(EXPORTS.validate(exportFormats));
        issues.addAll(RULES.validate(conflictRules));
        issues.addAll(ANALYZERS.validate(qualityAnalyzers));
        return issues;
    }

    @Override
    public String toString() {
        return "Domain[" + domainId + " " + version + "]";
    }

    /**
     * Builder for {@link Domain}. Not thread-safe.
     */
    public static final class Builder {

        private final String domainId;
        private final String name;
        private String version = "1.0.0";
        private String description;
        private List<String> categories = List.of();
        private List<Question> questions = List.of();
        private List<ExportFormat> exportFormats = List.of();
        private List<ConflictRule> conflictRules = List.of();
        private List<QualityAnalyzer> qualityAnalyzers = List.of();

        private Builder(String domainId, String name) {
            this.domainId = domainId;
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = orEmpty(categories);
            return this;
        }

        public Builder questions(List<Question> questions) {
            this.questions = orEmpty(questions);
            return this;
        }

        public Builder exportFormats(List<ExportFormat> exportFormats) {
            this.exportFormats = orEmpty(exportFormats);
            return this;
        }

        public Builder conflictRules(List<ConflictRule> conflictRules) {
            this.conflictRules = orEmpty(conflictRules);
            return this;
        }

        public Builder qualityAnalyzers(List<QualityAnalyzer> qualityAnalyzers) {
            this.qualityAnalyzers = orEmpty(qualityAnalyzers);
            return this;
        }

        public Domain build() {
            return new Domain(this);
        }

        private static <E> List<E> orEmpty(List<E> list) {
            return list == null ? List.of() : new ArrayList<>(list);
        }
    }
}
