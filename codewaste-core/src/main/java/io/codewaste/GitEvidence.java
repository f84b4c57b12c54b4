package io.codewaste;

/**
 * Blame and history statistics for one entity.
 *
 * <p>When blame could not attribute any line, {@code available} is false and
 * only the file-level counts are set.</p>
 */
public record GitEvidence(
    String entityId,

    /** Whether line-level attribution was obtainable */
    boolean available,

    /** Distinct commits touching the entity's lines */
    Integer commitCount,

    /** Distinct authors of those commits */
    Integer authorCount,

    /** Share of lines attributed to the most represented commit */
    Double concentration,

    /** Age in days of the most recent touching commit */
    Integer lastCommitAgeDays,

    /** Commits touching the whole file */
    int fileCommitCount,

    /** Authors of the whole file */
    int fileAuthorCount
) {
    public static GitEvidence unavailable(String entityId, int fileCommitCount, int fileAuthorCount) {
        return new GitEvidence(entityId, false, null, null, null, null, fileCommitCount, fileAuthorCount);
    }
}
