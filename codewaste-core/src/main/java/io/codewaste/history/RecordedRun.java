package io.codewaste.history;

/**
 * A run row as read back from the history database.
 */
public record RecordedRun(
    long id,
    String repoPath,
    String scannedAt,
    int functionsScanned,
    int probableAiFunctions,
    int highConfidenceDuplicationPairs,
    int runtimeZeroInvocations,
    int probableAiZeroInvocations,
    double estimatedAnnualizedAvoidableRuntimeCost
) {}
