package io.codewaste.findings;

import java.util.List;
import java.util.Objects;

/**
 * A correlation of static and runtime evidence that merits human review.
 */
public record Finding(
    FindingType type,

    Severity severity,

    String title,

    /** Entities the finding is about */
    List<String> entityIds,

    /** "key=value" evidence items */
    List<String> evidence,

    /** Annualized cost estimate, or null when no cost per invocation was given */
    Double estimatedAnnualCost
) {
    public Finding {
        Objects.requireNonNull(type, "type cannot be null");
        entityIds = List.copyOf(entityIds);
        evidence = List.copyOf(evidence);
    }

    public static Finding of(FindingType type, List<String> entityIds, List<String> evidence) {
        return new Finding(type, type.severity(), type.title(), entityIds, evidence, null);
    }

    public static Finding of(FindingType type, List<String> entityIds, List<String> evidence,
                             Double estimatedAnnualCost) {
        return new Finding(type, type.severity(), type.title(), entityIds, evidence, estimatedAnnualCost);
    }
}
