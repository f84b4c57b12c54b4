package io.codewaste.duplication;

import java.util.List;

/**
 * Canonical form of one entity, used only for pairwise comparison.
 */
public record CanonicalSignature(
    String entityId,

    /** Canonical token sequence */
    List<String> tokens,

    /** Top-level statements in the function body */
    int bodyStatements
) {
    public CanonicalSignature {
        tokens = List.copyOf(tokens);
    }

    /** Space-joined tokens. */
    public String text() {
        return String.join(" ", tokens);
    }
}
