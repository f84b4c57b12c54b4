package io.codewaste.provenance;

import io.codewaste.GitEvidence;

import java.util.List;
import java.util.function.Predicate;

/**
 * Score adjustment drawn from version-control history. Applies only to
 * evidence that is {@link GitEvidence#available() available}.
 */
public record GitAdjustment(String label, double weight, Predicate<GitEvidence> condition) {

    public static final List<GitAdjustment> ADJUSTMENTS = List.of(
        new GitAdjustment("single-source commit concentration", 0.10,
            e -> e.concentration() >= 0.85 && e.commitCount() <= 2),
        new GitAdjustment("recent introduction window", 0.05,
            e -> e.lastCommitAgeDays() <= 45 && e.commitCount() <= 3),
        new GitAdjustment("low-author diversity file", 0.05,
            e -> e.fileAuthorCount() <= 1 && e.fileCommitCount() <= 3),
        new GitAdjustment("sustained multi-commit history", -0.10,
            e -> e.commitCount() >= 6),
        new GitAdjustment("multi-author ownership", -0.10,
            e -> e.authorCount() >= 3),
        new GitAdjustment("long-standing untouched code", -0.05,
            e -> e.lastCommitAgeDays() >= 365)
    );

    public boolean matches(GitEvidence evidence) {
        return evidence.available() && condition.test(evidence);
    }
}
