package com.specintel.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Difficulty of a question. Questions without a difficulty rank as {@link #MEDIUM}.
 */
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Difficulty> fromValue(String value) {
        return Arrays.stream(values())
            .filter(difficulty -> difficulty.value.equals(value))
            .findFirst();
    }
}
