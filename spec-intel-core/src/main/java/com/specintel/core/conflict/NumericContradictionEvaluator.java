package com.specintel.core.conflict;

import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Flags specifications of one category that set different numeric targets.
 *
 * <p>The category comes from the rule's condition text, which must contain
 * {@code category '<name>'}, for example
 * {@code "no two current specs in category 'performance' may set contradictory numeric targets"}.
 *
 * <p>The first standalone number in each specification value is its target; digits inside
 * words such as {@code p99} or {@code OAuth2} are not numbers. Numbers are normalized
 * within a unit family before comparison, so {@code "1s"} and {@code "1000 ms"} agree:
 * <ul>
 *   <li>time: ms, s, min, h, d (compared in milliseconds)</li>
 *   <li>size: B, KB, MB, GB, TB (compared in bytes, 1024-based)</li>
 *   <li>rate: rps, req/s, qps, requests per second</li>
 *   <li>percent: %, percent</li>
 *   <li>bare numbers without a unit</li>
 * </ul>
 * Values without a number are ignored. Each family whose targets disagree yields one
 * violation naming every specification in that family.
 */
public class NumericContradictionEvaluator implements ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(NumericContradictionEvaluator.class);

    private static final Pattern CATEGORY_PATTERN = Pattern.compile("category\\s+'([^']+)'", Pattern.CASE_INSENSITIVE);

    private static final Pattern TARGET_PATTERN = Pattern.compile(
        "(?<![\\w.])(\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?)\\s*"
            + "(ms|milliseconds?|seconds?|secs?|s|minutes?|mins?|hours?|hrs?|h|days?|d"
            + "|tb|gb|mb|kb|bytes?|b"
            + "|rps|qps|req/s|requests?/s|requests? per second"
            + "|%|percent)?(?![a-z\\d])",
        Pattern.CASE_INSENSITIVE);

    private final Set<String> knownCategories;
    private final boolean restricted;

    /**
     * Creates an evaluator that accepts any category named in a condition.
     */
    public NumericContradictionEvaluator() {
        this(Set.of(), false);
    }

    /**
     * Creates an evaluator that fails rules naming a category outside {@code knownCategories},
     * typically a domain's category list. An empty collection accepts any category.
     *
     * @param knownCategories categories rules may refer to
     */
    public NumericContradictionEvaluator(Collection<String> knownCategories) {
        this(normalizeAll(knownCategories), !knownCategories.isEmpty());
    }

    private NumericContradictionEvaluator(Set<String> knownCategories, boolean restricted) {
        this.knownCategories = knownCategories;
        this.restricted = restricted;
    }

    /**
     * Binds the evaluator to a domain's categories. Unlike the constructor, an empty list
     * means the domain declares no categories, so every category reference fails.
     */
    @Override
    public ConditionEvaluator withCategories(Collection<String> categories) {
        return new NumericContradictionEvaluator(normalizeAll(categories), true);
    }

    @Override
    public List<Violation> evaluate(ConflictRule rule, List<Specification> snapshot) {
        String category = referencedCategory(rule);

        Map<UnitFamily, Map<Specification, BigDecimal>> targets = new EnumMap<>(UnitFamily.class);
        for (Specification spec : snapshot) {
            if (!category.equals(normalize(spec.category()))) {
                continue;
            }
            parseTarget(spec.value()).ifPresent(target ->
                targets.computeIfAbsent(target.family(), k -> new LinkedHashMap<>()).put(spec, target.amount()));
        }

        List<Violation> violations = new ArrayList<>();
        targets.forEach((family, amounts) -> {
            long distinct = amounts.values().stream().map(BigDecimal::stripTrailingZeros).distinct().count();
            if (distinct > 1) {
                List<String> ids = amounts.keySet().stream().map(Specification::id).toList();
                String detail = amounts.keySet().stream()
                    .map(spec -> spec.key() + "=" + spec.value())
                    .collect(Collectors.joining(", "));
                log.debug("Rule {} found {} contradictory {} target(s) in '{}'",
                    rule.ruleId(), ids.size(), family.name().toLowerCase(Locale.ROOT), category);
                violations.add(new Violation(ids, family.name().toLowerCase(Locale.ROOT) + " targets disagree: " + detail));
            }
        });
        return violations;
    }

    private String referencedCategory(ConflictRule rule) {
        Matcher matcher = CATEGORY_PATTERN.matcher(rule.condition() == null ? "" : rule.condition());
        if (!matcher.find()) {
            throw new RuleEvaluationException(rule.ruleId(),
                "Condition does not name a category: " + rule.condition());
        }
        String category = normalize(matcher.group(1));
        if (restricted && !knownCategories.contains(category)) {
            throw new RuleEvaluationException(rule.ruleId(),
                "Condition refers to unknown category '" + matcher.group(1) + "'");
        }
        return category;
    }

    static Optional<Target> parseTarget(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = TARGET_PATTERN.matcher(value);
        if (!matcher.find()) {
            return Optional.empty();
        }
        BigDecimal number = new BigDecimal(matcher.group(1).replace(",", ""));
        String unit = matcher.group(2) == null ? "" : matcher.group(2).toLowerCase(Locale.ROOT);
        return Optional.of(normalizeUnit(number, unit));
    }

    private static Target normalizeUnit(BigDecimal number, String unit) {
        if (unit.isEmpty()) {
            return new Target(UnitFamily.BARE, number);
        }
        if (unit.equals("%") || unit.equals("percent")) {
            return new Target(UnitFamily.PERCENT, number);
        }
        if (unit.equals("rps") || unit.equals("qps") || unit.contains("/s") || unit.contains("per second")) {
            return new Target(UnitFamily.RATE, number);
        }
        if (unit.startsWith("ms") || unit.startsWith("milli")) {
            return new Target(UnitFamily.TIME, number);
        }
        if (unit.startsWith("s")) {
            return new Target(UnitFamily.TIME, number.multiply(BigDecimal.valueOf(1_000L)));
        }
        if (unit.startsWith("min")) {
            return new Target(UnitFamily.TIME, number.multiply(BigDecimal.valueOf(60_000L)));
        }
        if (unit.startsWith("h")) {
            return new Target(UnitFamily.TIME, number.multiply(BigDecimal.valueOf(3_600_000L)));
        }
        if (unit.startsWith("d")) {
            return new Target(UnitFamily.TIME, number.multiply(BigDecimal.valueOf(86_400_000L)));
        }
        long factor = switch (unit) {
            case "kb" -> 1L << 10;
            case "mb" -> 1L << 20;
            case "gb" -> 1L << 30;
            case "tb" -> 1L << 40;
            default -> 1L;
        };
        return new Target(UnitFamily.SIZE, number.multiply(BigDecimal.valueOf(factor)));
    }

    private static Set<String> normalizeAll(Collection<String> categories) {
        return categories.stream()
            .map(NumericContradictionEvaluator::normalize)
            .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }

    enum UnitFamily {
        TIME,
        SIZE,
        RATE,
        PERCENT,
        BARE
    }

    record Target(UnitFamily family, BigDecimal amount) {}
}
