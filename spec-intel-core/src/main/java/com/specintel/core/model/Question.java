package com.specintel.core.model;

import java.util.List;

/**
 * A question a domain asks while gathering specifications.
 *
 * <p>Domain metadata only: the engine never asks questions itself.
 *
 * @param id unique question ID within a question set
 * @param category specification category the question belongs to
 * @param text the question
 * @param helpText guidance shown with the question, may be null
 * @param difficulty optional difficulty
 * @param exampleAnswer optional sample answer
 * @param followUpQuestions IDs of questions worth asking afterwards
 * @param dependencies IDs of questions that should be answered first
 */
public record Question(
    String id,
    String category,
    String text,
    String helpText,
    Difficulty difficulty,
    String exampleAnswer,
    List<String> followUpQuestions,
    List<String> dependencies
) {
    /**
     * Compact constructor normalizing collections.
     */
    public Question {
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Creates a question without difficulty, example or relations.
     *
     * @param id question ID
     * @param category category
     * @param text question text
     * @return new question
     */
    public static Question of(String id, String category, String text) {
        return new Question(id, category, text, null, null, null, List.of(), List.of());
    }

    /**
     * @return difficulty, treating a missing value as medium
     */
    public Difficulty effectiveDifficulty() {
        return difficulty != null ? difficulty : Difficulty.MEDIUM;
    }
}
