package com.specintel.core.domain;

/**
 * Counts describing a registered domain.
 *
 * @param domainId domain ID
 * @param name display name
 * @param version domain version
 * @param categoryCount number of categories
 * @param questionCount number of questions
 * @param exportFormatCount number of export formats
 * @param conflictRuleCount number of conflict rules
 * @param qualityAnalyzerCount number of declared analyzers
 */
public record DomainSummary(
    String domainId,
    String name,
    String version,
    int categoryCount,
    int questionCount,
    int exportFormatCount,
    int conflictRuleCount,
    int qualityAnalyzerCount
) {}
