package io.codewaste.findings;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of review finding.
 */
public enum FindingType {
    /** Probable generated function with zero runtime invocations */
    RUNTIME_UNUSED_REVIEW("runtime_unused_review", Severity.LOW,
        "Probable AI-generated function with zero runtime usage"),

    /** High-confidence generated, unused and duplicated */
    DELETE_CANDIDATE_REVIEW("delete_candidate_review", Severity.LOW,
        "High-confidence delete candidate (human review required)"),

    /** Duplicated logic where both copies are invoked */
    CONSOLIDATION_CANDIDATE_REVIEW("consolidation_candidate_review", Severity.MEDIUM,
        "High-overlap active duplicate logic (human review required)");

    private final String label;
    private final Severity severity;
    private final String title;

    FindingType(String label, Severity severity, String title) {
        this.label = label;
        this.severity = severity;
        this.title = title;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Severity severity() {
        return severity;
    }

    public String title() {
        return title;
    }
}
