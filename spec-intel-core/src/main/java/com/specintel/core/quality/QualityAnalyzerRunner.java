package com.specintel.core.quality;

import com.specintel.core.model.QualityAnalyzer;
import com.specintel.core.model.QualityIssue;
import com.specintel.core.model.Specification;

import java.util.List;

/**
 * Implementation of a declared quality analyzer, e.g. a bias or security check.
 *
 * <p>The scorer only decides which analyzers run and aggregates what they return.
 */
@FunctionalInterface
public interface QualityAnalyzerRunner {

    /**
     * @param analyzer declaration being run
     * @param snapshot current, non-deprecated specifications of one project
     * @return issues found, empty if none
     */
    List<QualityIssue> analyze(QualityAnalyzer analyzer, List<Specification> snapshot);
}
