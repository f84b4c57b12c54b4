package io.codewaste.findings;

/**
 * Headline counts of one diagnostic run.
 */
public record DiagnosticSummary(
    int functionsScanned,
    int probableAiFunctions,
    int highConfidenceAiFunctions,
    int highConfidenceDuplicationPairs,
    int runtimeZeroInvocations,
    int runtimeUnknown,
    int probableAiZeroInvocations,
    int gitEvidenceAvailable,
    double estimatedAnnualizedAvoidableRuntimeCost
) {}
