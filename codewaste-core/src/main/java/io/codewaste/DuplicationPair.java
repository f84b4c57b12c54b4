package io.codewaste;

import java.util.Objects;

/**
 * Two structurally near-identical entities.
 *
 * <p>Pairs are unordered and reported once; {@code entityA} is the entity
 * that comes first in scan order.</p>
 */
public record DuplicationPair(
    /** Id of the earlier entity in scan order */
    String entityA,

    /** Id of the later entity in scan order */
    String entityB,

    /** Sequence similarity of the canonical signatures (0.0 to 1.0) */
    double similarity,

    Confidence confidence
) {
    public DuplicationPair {
        Objects.requireNonNull(entityA, "entityA cannot be null");
        Objects.requireNonNull(entityB, "entityB cannot be null");
        Objects.requireNonNull(confidence, "confidence cannot be null");
        if (entityA.equals(entityB)) {
            throw new IllegalArgumentException("A pair needs two distinct entities: " + entityA);
        }
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be within [0, 1]: " + similarity);
        }
    }

    public boolean involves(String entityId) {
        return entityA.equals(entityId) || entityB.equals(entityId);
    }

    @Override
    public String toString() {
        return String.format("[%.3f %s] %s <-> %s", similarity, confidence.label(), entityA, entityB);
    }
}
