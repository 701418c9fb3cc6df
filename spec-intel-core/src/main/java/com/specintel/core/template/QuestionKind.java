package com.specintel.core.template;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.model.Difficulty;
import com.specintel.core.model.Question;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Record kind for domain questions.
 *
 * <p>Besides the generic checks, a question set must not reference unknown questions
 * in {@code dependencies} and must not contain dependency cycles.
 */
public final class QuestionKind implements RecordKind<Question> {

    static final String QUESTION_ID = "question_id";
    static final String CATEGORY = "category";
    static final String TEXT = "text";
    static final String HELP_TEXT = "help_text";
    static final String DIFFICULTY = "difficulty";
    static final String EXAMPLE_ANSWER = "example_answer";
    static final String FOLLOW_UP_QUESTIONS = "follow_up_questions";
    static final String DEPENDENCIES = "dependencies";

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.requiredText(QUESTION_ID),
        FieldSpec.requiredText(CATEGORY),
        FieldSpec.requiredText(TEXT).withoutIndex(),
        FieldSpec.optionalText(HELP_TEXT),
        FieldSpec.optionalChoice(DIFFICULTY, Arrays.stream(Difficulty.values()).map(Difficulty::value).toList()),
        FieldSpec.optionalText(EXAMPLE_ANSWER),
        FieldSpec.list(FOLLOW_UP_QUESTIONS, false),
        FieldSpec.list(DEPENDENCIES, true)
    );

    @Override
    public String name() {
        return "question";
    }

    @Override
    public String idField() {
        return QUESTION_ID;
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public Question bind(StructuredRecord record) {
        String difficulty = record.text(DIFFICULTY);
        return new Question(
            record.text(QUESTION_ID),
            record.text(CATEGORY),
            record.text(TEXT),
            record.text(HELP_TEXT),
            difficulty == null ? null : Difficulty.fromValue(difficulty).orElseThrow(),
            record.text(EXAMPLE_ANSWER),
            record.list(FOLLOW_UP_QUESTIONS),
            record.list(DEPENDENCIES)
        );
    }

    @Override
    public void unbind(Question question, ObjectNode target) {
        StructuredRecord.putText(target, QUESTION_ID, question.id());
        StructuredRecord.putText(target, CATEGORY, question.category());
        StructuredRecord.putText(target, TEXT, question.text());
        StructuredRecord.putText(target, HELP_TEXT, question.helpText());
        StructuredRecord.putText(target, DIFFICULTY,
            question.difficulty() == null ? null : question.difficulty().value());
        StructuredRecord.putText(target, EXAMPLE_ANSWER, question.exampleAnswer());
        StructuredRecord.putList(target, FOLLOW_UP_QUESTIONS, question.followUpQuestions());
        StructuredRecord.putList(target, DEPENDENCIES, question.dependencies());
    }

    @Override
    public List<ValidationIssue> checkSet(List<Question> questions) {
        Map<String, Question> byId = questions.stream()
            .filter(q -> q.id() != null)
            .collect(Collectors.toMap(Question::id, Function.identity(), (a, b) -> a));

        List<ValidationIssue> issues = new ArrayList<>();
        for (Question question : questions) {
            for (String dependency : question.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    issues.add(new ValidationIssue(name(), question.id(), DEPENDENCIES,
                        IssueType.UNKNOWN_REFERENCE, "depends on unknown question '" + dependency + "'"));
                }
            }
        }
        for (Question question : questions) {
            if (question.id() != null && reachesItself(question.id(), question, byId, new HashSet<>())) {
                issues.add(new ValidationIssue(name(), question.id(), DEPENDENCIES,
                    IssueType.CIRCULAR_DEPENDENCY, "has circular dependencies"));
            }
        }
        return issues;
    }

    private static boolean reachesItself(String origin, Question current, Map<String, Question> byId, Set<String> visited) {
        for (String dependency : current.dependencies()) {
            if (dependency.equals(origin)) {
                return true;
            }
            Question next = byId.get(dependency);
            if (next != null && visited.add(dependency) && reachesItself(origin, next, byId, visited)) {
                return true;
            }
        }
        return false;
    }
}
