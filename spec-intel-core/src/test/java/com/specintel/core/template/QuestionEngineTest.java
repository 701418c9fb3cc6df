package com.specintel.core.template;

import com.specintel.core.config.ConfigException;
import com.specintel.core.model.Difficulty;
import com.specintel.core.model.Question;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link QuestionEngine}.
 */
class QuestionEngineTest {

    private final QuestionEngine engine = new QuestionEngine();

    @TempDir
    Path tempDir;

    private static Question question(String id, String category, Difficulty difficulty, String... dependencies) {
        return new Question(id, category, "Question " + id + "?", null, difficulty, null, List.of(), List.of(dependencies));
    }

    @Test
    void load_fullRecord_bindsOptionalFields() {
        List<Question> questions = engine.load(List.of(Map.of(
            "question_id", "perf_1",
            "category", "Performance",
            "text", "What is your target response time?",
            "help_text", "e.g., API response: <200ms",
            "difficulty", "medium",
            "example_answer", "API response: <200ms",
            "follow_up_questions", List.of("perf_2"),
            "dependencies", List.of()),
            Map.of("question_id", "perf_2", "category", "Performance", "text", "Throughput?")));

        assertThat(questions).hasSize(2);
        Question first = questions.get(0);
        assertThat(first.difficulty()).isEqualTo(Difficulty.MEDIUM);
        assertThat(first.helpText()).isEqualTo("e.g., API response: <200ms");
        assertThat(first.followUpQuestions()).containsExactly("perf_2");
        assertThat(questions.get(1).difficulty()).isNull();
        assertThat(questions.get(1).effectiveDifficulty()).isEqualTo(Difficulty.MEDIUM);
    }

    @Test
    void load_illegalDifficulty_throwsConfigException() {
        assertThatThrownBy(() -> engine.load(List.of(Map.of(
            "question_id", "q1", "category", "Security", "text", "Why?", "difficulty", "extreme"))))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("difficulty");
    }

    @Test
    void load_dependenciesNotAList_throwsConfigException() {
        assertThatThrownBy(() -> engine.load(List.of(Map.of(
            "question_id", "q1", "category", "Security", "text", "Why?", "dependencies", "q0"))))
            .isInstanceOfSatisfying(ConfigException.class, e -> assertThat(e.issues())
                .extracting(ValidationIssue::type)
                .containsExactly(IssueType.INVALID_FORMAT));
    }

    @Test
    void validate_circularDependencies_reportsEveryQuestionInCycle() {
        List<Question> questions = List.of(
            question("a", "Security", null, "b"),
            question("b", "Security", null, "a"),
            question("c", "Security", null));

        List<ValidationIssue> issues = engine.validate(questions);

        assertThat(issues)
            .filteredOn(issue -> issue.type() == IssueType.CIRCULAR_DEPENDENCY)
            .extracting(ValidationIssue::recordId)
            .containsExactly("a", "b");
    }

    @Test
    void validate_unknownDependency_reportsReference() {
        List<ValidationIssue> issues = engine.validate(List.of(question("a", "Security", null, "missing")));

        assertThat(issues).singleElement()
            .satisfies(issue -> {
                assertThat(issue.type()).isEqualTo(IssueType.UNKNOWN_REFERENCE);
                assertThat(issue.message()).contains("missing");
            });
    }

    @Test
    void filterByDifficulty_matchesDeclaredDifficultyOnly() {
        List<Question> questions = List.of(
            question("a", "Performance", Difficulty.EASY),
            question("b", "Performance", null),
            question("c", "Security", Difficulty.EASY));

        assertThat(engine.filterByDifficulty(questions, Difficulty.EASY))
            .extracting(Question::id)
            .containsExactly("a", "c");
    }

    @Test
    void groupByCategory_keepsFirstAppearanceOrder() {
        List<Question> questions = List.of(
            question("a", "Security", null),
            question("b", "Performance", null),
            question("c", "Security", null));

        assertThat(engine.groupByCategory(questions).keySet()).containsExactly("Security", "Performance");
    }

    @Test
    void groupBy_dependencies_listsQuestionUnderEveryDependency() {
        List<Question> questions = List.of(
            question("a", "Security", null),
            question("b", "Security", null),
            question("c", "Security", null, "a", "b"));

        Map<String, List<Question>> groups = engine.groupBy(questions, "dependencies");

        assertThat(groups).containsOnlyKeys("a", "b");
        assertThat(groups.get("a")).extracting(Question::id).containsExactly("c");
        assertThat(groups.get("b")).extracting(Question::id).containsExactly("c");
    }

    @Test
    void answerable_excludesQuestionsWithOpenDependencies() {
        List<Question> questions = List.of(
            question("a", "Security", null),
            question("b", "Security", null, "a"));

        assertThat(engine.answerable(questions, Set.of())).extracting(Question::id).containsExactly("a");
        assertThat(engine.answerable(questions, Set.of("a"))).extracting(Question::id).containsExactly("a", "b");
    }

    @Test
    void nextQuestions_ordersByDifficultyAndSkipsAnswered() {
        List<Question> questions = List.of(
            question("hard_one", "Performance", Difficulty.HARD),
            question("unrated", "Performance", null),
            question("easy_one", "Performance", Difficulty.EASY),
            question("blocked", "Performance", Difficulty.EASY, "hard_one"),
            question("other", "Security", Difficulty.EASY));

        List<Question> next = engine.nextQuestions(questions, Set.of("easy_one"), "Performance", 5);

        assertThat(next).extracting(Question::id).containsExactly("unrated", "hard_one");
    }

    @Test
    void nextQuestions_withoutCategory_truncatesToLimit() {
        List<Question> questions = List.of(
            question("a", "Performance", Difficulty.MEDIUM),
            question("b", "Security", Difficulty.EASY),
            question("c", "Security", Difficulty.EASY));

        assertThat(engine.nextQuestions(questions, Set.of(), null, 2))
            .extracting(Question::id)
            .containsExactly("b", "c");
        assertThat(engine.nextQuestions(questions, Set.of(), null, 0)).isEmpty();
    }

    @Test
    void toStructured_thenLoad_yieldsEqualQuestions() {
        List<Question> questions = List.of(
            new Question("q1", "Security", "How?", "help", Difficulty.HARD, "like this", List.of("q2"), List.of()),
            question("q2", "Security", null, "q1"));

        assertThat(engine.load(engine.toStructured(questions))).isEqualTo(questions);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0x10", "1_000", "1e3", "0b101", ".inf", "-.Inf", ".nan", "~", "null", "yes", "off",
        "2026-01-01", "1.10", "007"})
    void toDocument_thenLoadDocument_keepsScalarLookingText(String text) {
        Question question = new Question("q1", "Performance", "Target?", text, null, text, List.of(), List.of());
        Path document = tempDir.resolve("questions.yaml");

        engine.toDocument(List.of(question), document);

        assertThat(engine.loadDocument(document)).containsExactly(question);
    }
}
