package com.specintel.core.template;

import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.Severity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Template engine for conflict rules.
 */
public class RuleEngine extends TemplateEngine<ConflictRule> {

    public RuleEngine() {
        super(new ConflictRuleKind());
    }

    public List<ConflictRule> filterBySeverity(List<ConflictRule> rules, Severity severity) {
        return filterBy(rules, ConflictRuleKind.SEVERITY, severity.value());
    }

    /**
     * Keeps rules whose name or description contains {@code pattern}, ignoring case.
     */
    public List<ConflictRule> filterByPattern(List<ConflictRule> rules, String pattern) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        return rules.stream()
            .filter(rule -> contains(rule.name(), needle) || contains(rule.description(), needle))
            .toList();
    }

    /**
     * Keeps rules whose {@code rule_id} starts with the category, lowercased
     * ({@code "SEC"} matches {@code sec_conflict}).
     */
    public List<ConflictRule> filterByCategory(List<ConflictRule> rules, String category) {
        String prefix = category.toLowerCase(Locale.ROOT);
        return rules.stream()
            .filter(rule -> rule.ruleId() != null && rule.ruleId().startsWith(prefix))
            .toList();
    }

    /**
     * Groups rules by category, taken from the {@code rule_id} prefix before the first
     * underscore ({@code perf_conflict} belongs to {@code perf}).
     */
    public Map<String, List<ConflictRule>> groupByCategory(List<ConflictRule> rules) {
        Map<String, List<ConflictRule>> categories = new LinkedHashMap<>();
        for (ConflictRule rule : rules) {
            categories.computeIfAbsent(ExportEngine.prefix(rule.ruleId()), k -> new ArrayList<>()).add(rule);
        }
        return categories;
    }

    /**
     * Groups rules by severity in error, warning, info order. Empty groups are omitted.
     */
    public Map<Severity, List<ConflictRule>> groupBySeverity(List<ConflictRule> rules) {
        Map<Severity, List<ConflictRule>> groups = new EnumMap<>(Severity.class);
        for (ConflictRule rule : rules) {
            if (rule.severity() != null) {
                groups.computeIfAbsent(rule.severity(), k -> new ArrayList<>()).add(rule);
            }
        }
        return groups;
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }
}
