package com.specintel.core.domain;

import com.specintel.core.model.Difficulty;
import com.specintel.core.model.ExportFormat;
import com.specintel.core.model.QualityAnalyzer;
import com.specintel.core.model.Question;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link Domain}.
 */
class DomainTest {

    private final Domain domain = Domain.builder("programming", "Software Programming")
        .categories(List.of("Performance", "Security"))
        .questions(List.of(
            new Question("perf_1", "Performance", "Response time?", null, Difficulty.MEDIUM, null, List.of(), List.of()),
            Question.of("sec_1", "Security", "Encryption?")))
        .exportFormats(List.of(new ExportFormat("java", "Java", null, ".java", "text/x-java-source", "java_class")))
        .qualityAnalyzers(List.of(
            new QualityAnalyzer("bias_detector", "Bias", null, "bias", true, true, List.of()),
            new QualityAnalyzer("style", "Style", null, "lint", false, false, List.of())))
        .build();

    @Test
    void lookups_returnMatchingRecords() {
        assertThat(domain.questionsByCategory("Security")).extracting(Question::id).containsExactly("sec_1");
        assertThat(domain.exportFormat("java")).isPresent();
        assertThat(domain.exportFormat("cobol")).isEmpty();
        assertThat(domain.enabledAnalyzers()).extracting(QualityAnalyzer::analyzerId).containsExactly("bias_detector");
        assertThat(domain.qualityAnalyzerIds()).containsExactly("bias_detector", "style");
    }

    @Test
    void summary_countsEachSet() {
        assertThat(domain.summary()).isEqualTo(new DomainSummary("programming", "Software Programming", "1.0.0",
            2, 2, 1, 0, 2));
    }

    @Test
    void builder_copiesLists() {
        List<String> categories = new ArrayList<>(List.of("Performance"));
        Domain built = Domain.builder("x", "X").categories(categories).build();

        categories.add("Security");

        assertThat(built.categories()).containsExactly("Performance");
        assertThatThrownBy(() -> built.categories().add("Other")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void validate_blankIdAndName_reportsMissingFields() {
        List<ValidationIssue> issues = Domain.builder(" ", null).build().validate();

        assertThat(issues)
            .extracting(ValidationIssue::field, ValidationIssue::type)
            .containsExactly(
                tuple("domain_id", IssueType.MISSING_FIELD),
                tuple("name", IssueType.MISSING_FIELD));
    }

    @Test
    void validate_duplicateCategoryIgnoringCase_reportsDuplicate() {
        List<ValidationIssue> issues = Domain.builder("x", "X")
            .categories(List.of("Security", " security "))
            .build()
            .validate();

        assertThat(issues).singleElement()
            .satisfies(issue -> assertThat(issue.type()).isEqualTo(IssueType.DUPLICATE_ID));
    }

    @Test
    void validate_nullCategory_reportsIllegalValue() {
        Domain withNull = Domain.builder("x", "X")
            .categories(Arrays.asList("Security", null))
            .build();

        assertThat(withNull.categories()).containsExactly("Security", null);
        assertThat(withNull.validate()).singleElement()
            .satisfies(issue -> {
                assertThat(issue.field()).isEqualTo("categories");
                assertThat(issue.type()).isEqualTo(IssueType.ILLEGAL_VALUE);
            });
    }

    @Test
    void validate_nullQuestion_reportsInvalidRecord() {
        Domain withNull = Domain.builder("x", "X")
            .questions(Arrays.asList(Question.of("q1", "Security", "Why?"), null))
            .build();

        assertThat(withNull.validate()).singleElement()
            .satisfies(issue -> assertThat(issue.type()).isEqualTo(IssueType.INVALID_FORMAT));
    }
}
