package com.specintel.core.conflict;

import com.specintel.core.model.Conflict;
import com.specintel.core.model.RuleEvaluationWarning;
import com.specintel.core.model.Severity;

import java.util.List;

/**
 * Outcome of one detection run.
 *
 * @param runId ID shared by every conflict of the run
 * @param projectId project the run covered
 * @param conflicts new conflicts, errors first, then warnings, then info
 * @param warnings rules that were skipped
 * @param rulesEvaluated number of rules evaluated successfully
 */
public record DetectionResult(
    String runId,
    String projectId,
    List<Conflict> conflicts,
    List<RuleEvaluationWarning> warnings,
    int rulesEvaluated
) {
    public DetectionResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public long count(Severity severity) {
        return conflicts.stream().filter(conflict -> conflict.severity() == severity).count();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
