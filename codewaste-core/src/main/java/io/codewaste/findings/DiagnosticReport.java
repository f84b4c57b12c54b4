package io.codewaste.findings;

import io.codewaste.AnalysisConfig;
import io.codewaste.AnalysisResult;
import io.codewaste.history.RunHistory;
import io.codewaste.runtime.RuntimeEvidence;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete output of one diagnostic run, ready for the report writers.
 */
public record DiagnosticReport(
    Path repository,
    Instant generatedAt,
    AnalysisConfig config,
    DiagnosticOptions options,
    AnalysisResult analysis,
    Map<String, RuntimeEvidence> runtimeEvidence,
    List<Finding> findings,
    DiagnosticSummary summary,

    /** Position in the run history, or null when history is not recorded */
    RunHistory history
) {
    public DiagnosticReport {
        runtimeEvidence = Collections.unmodifiableMap(new LinkedHashMap<>(runtimeEvidence));
        findings = List.copyOf(findings);
    }

    public DiagnosticReport withHistory(RunHistory history) {
        return new DiagnosticReport(repository, generatedAt, config, options, analysis, runtimeEvidence,
            findings, summary, history);
    }
}
