package io.codewaste.history;

import io.codewaste.findings.DiagnosticSummary;

/**
 * Change in headline counts since the previous run of the same repository.
 */
public record RunTrend(
    int functionsScannedDelta,
    int probableAiFunctionsDelta,
    int highConfidenceDuplicationPairsDelta,
    int runtimeZeroInvocationsDelta,
    int probableAiZeroInvocationsDelta,

    /** Rounded to cents */
    double estimatedAnnualizedAvoidableRuntimeCostDelta
) {
    static RunTrend between(DiagnosticSummary current, RecordedRun previous) {
        double costDelta = current.estimatedAnnualizedAvoidableRuntimeCost()
            - previous.estimatedAnnualizedAvoidableRuntimeCost();
        return new RunTrend(
            current.functionsScanned() - previous.functionsScanned(),
            current.probableAiFunctions() - previous.probableAiFunctions(),
            current.highConfidenceDuplicationPairs() - previous.highConfidenceDuplicationPairs(),
            current.runtimeZeroInvocations() - previous.runtimeZeroInvocations(),
            current.probableAiZeroInvocations() - previous.probableAiZeroInvocations(),
            Math.round(costDelta * 100.0) / 100.0
        );
    }
}
