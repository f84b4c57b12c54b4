package io.codewaste.history;

/**
 * Where a diagnostic run landed in the history database.
 */
public record RunHistory(
    /** Id of the run just recorded */
    long runId,

    /** UTC timestamp of the run just recorded, "yyyy-MM-dd HH:mm:ssZ" */
    String scannedAt,

    /** Previous run of the same repository, or null for the first run */
    Long previousRunId,

    String previousScannedAt,

    /** Deltas against the previous run, or null for the first run */
    RunTrend trend
) {
    static RunHistory first(long runId, String scannedAt) {
        return new RunHistory(runId, scannedAt, null, null, null);
    }

    public boolean hasPrevious() {
        return previousRunId != null;
    }
}
