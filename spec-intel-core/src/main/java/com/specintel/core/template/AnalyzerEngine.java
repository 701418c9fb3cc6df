package com.specintel.core.template;

import com.specintel.core.model.QualityAnalyzer;

import java.util.List;

/**
 * Template engine for quality analyzer declarations.
 */
public class AnalyzerEngine extends TemplateEngine<QualityAnalyzer> {

    public AnalyzerEngine() {
        super(new QualityAnalyzerKind());
    }

    public List<QualityAnalyzer> enabled(List<QualityAnalyzer> analyzers) {
        return filterBy(analyzers, QualityAnalyzerKind.ENABLED, "true");
    }

    public List<QualityAnalyzer> required(List<QualityAnalyzer> analyzers) {
        return filterBy(analyzers, QualityAnalyzerKind.REQUIRED, "true");
    }

    public List<QualityAnalyzer> optional(List<QualityAnalyzer> analyzers) {
        return filterBy(analyzers, QualityAnalyzerKind.REQUIRED, "false");
    }

    public List<QualityAnalyzer> filterByTag(List<QualityAnalyzer> analyzers, String tag) {
        return filterBy(analyzers, QualityAnalyzerKind.TAGS, tag);
    }

    public List<QualityAnalyzer> filterByType(List<QualityAnalyzer> analyzers, String analyzerType) {
        return filterBy(analyzers, QualityAnalyzerKind.ANALYZER_TYPE, analyzerType);
    }

    /**
     * @return analyzers marked required that are switched off
     */
    public List<QualityAnalyzer> missingRequired(List<QualityAnalyzer> analyzers) {
        return analyzers.stream()
            .filter(QualityAnalyzer::isRequiredButDisabled)
            .toList();
    }
}
