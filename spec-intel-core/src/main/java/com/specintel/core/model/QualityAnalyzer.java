package com.specintel.core.model;

import java.util.List;

/**
 * Declaration of a quality analyzer a domain runs when scoring.
 *
 * <p>The analysis itself is implemented elsewhere; this record only tracks identity
 * and on/off/required state.
 *
 * @param analyzerId unique analyzer ID
 * @param name display name
 * @param description optional description
 * @param analyzerType kind of analysis, e.g. "bias_detector"
 * @param enabled whether the analyzer runs
 * @param required whether a score is authoritative only when this analyzer runs
 * @param tags labels used for filtering and grouping
 */
public record QualityAnalyzer(
    String analyzerId,
    String name,
    String description,
    String analyzerType,
    boolean enabled,
    boolean required,
    List<String> tags
) {
    /**
     * Compact constructor normalizing tags.
     */
    public QualityAnalyzer {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * @return true if the analyzer is required but switched off
     */
    public boolean isRequiredButDisabled() {
        return required && !enabled;
    }
}
