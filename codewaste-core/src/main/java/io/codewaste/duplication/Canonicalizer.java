package io.codewaste.duplication;

import io.codewaste.CodeEntity;

import java.util.Optional;

/**
 * Rewrites an entity into a form where renamed identifiers and changed
 * literals no longer matter.
 */
public interface Canonicalizer {

    /**
     * @return the signature, or empty if the entity's source holds no
     *         function with a body
     */
    Optional<CanonicalSignature> canonicalize(CodeEntity entity);
}
