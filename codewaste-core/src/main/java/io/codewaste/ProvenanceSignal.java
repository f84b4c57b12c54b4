package io.codewaste;

import java.util.List;
import java.util.Objects;

/**
 * Heuristic estimate that an entity was machine-generated.
 */
public record ProvenanceSignal(
    String entityId,

    /** Probability estimate, never above 0.99 */
    double probability,

    Confidence confidence,

    /** Labels of the rules that contributed, in evaluation order */
    List<String> signals
) {
    public static final double HIGH_CONFIDENCE_SCORE = 0.8;

    public ProvenanceSignal {
        Objects.requireNonNull(entityId, "entityId cannot be null");
        Objects.requireNonNull(confidence, "confidence cannot be null");
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    /**
     * Creates a signal whose confidence tier follows from the probability.
     */
    public static ProvenanceSignal of(String entityId, double probability, List<String> signals) {
        Confidence confidence = probability >= HIGH_CONFIDENCE_SCORE ? Confidence.HIGH : Confidence.MEDIUM;
        return new ProvenanceSignal(entityId, probability, confidence, signals);
    }
}
