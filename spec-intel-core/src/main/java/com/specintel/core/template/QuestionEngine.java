package com.specintel.core.template;

import com.specintel.core.model.Difficulty;
import com.specintel.core.model.Question;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Template engine for questions, with dependency-aware question ordering.
 *
 * <pre>{@code
 * QuestionEngine engine = new QuestionEngine();
 * List<Question> questions = engine.loadDocument(Path.of("questions.yaml"));
 * List<Question> next = engine.nextQuestions(questions, answered, "Security", 5);
 * }</pre>
 */
public class QuestionEngine extends TemplateEngine<Question> {

    public QuestionEngine() {
        super(new QuestionKind());
    }

    public List<Question> filterByCategory(List<Question> questions, String category) {
        return filterBy(questions, QuestionKind.CATEGORY, category);
    }

    public List<Question> filterByDifficulty(List<Question> questions, Difficulty difficulty) {
        return filterBy(questions, QuestionKind.DIFFICULTY, difficulty.value());
    }

    public Map<String, List<Question>> groupByCategory(List<Question> questions) {
        return groupBy(questions, QuestionKind.CATEGORY);
    }

    /**
     * Keeps questions whose dependencies have all been answered.
     *
     * @param questions candidate questions
     * @param answeredIds IDs of answered questions
     * @return answerable questions in source order
     */
    public List<Question> answerable(List<Question> questions, Collection<String> answeredIds) {
        Set<String> answered = new HashSet<>(answeredIds);
        return questions.stream()
            .filter(question -> answered.containsAll(question.dependencies()))
            .toList();
    }

    /**
     * Picks the next questions to ask.
     *
     * <p>Keeps answerable, not yet answered questions, optionally of one category, ordered
     * easy, medium, hard (ties keep source order), and returns at most {@code limit}.
     *
     * @param questions all questions of a domain
     * @param answeredIds IDs of answered questions
     * @param category category to restrict to, or null for all
     * @param limit maximum number of questions
     * @return next questions to ask
     */
    public List<Question> nextQuestions(List<Question> questions, Collection<String> answeredIds,
                                        String category, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<String> answered = new HashSet<>(answeredIds);
        return answerable(questions, answered).stream()
            .filter(question -> !answered.contains(question.id()))
            .filter(question -> category == null || category.equals(question.category()))
            .sorted(Comparator.comparing(Question::effectiveDifficulty))
            .limit(limit)
            .toList();
    }
}
