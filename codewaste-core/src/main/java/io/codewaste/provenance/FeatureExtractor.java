package io.codewaste.provenance;

import io.codewaste.CodeEntity;

import java.util.Optional;

/**
 * Measures the first function in an entity's source.
 */
public interface FeatureExtractor {

    /**
     * @return features, or empty if no function with a body can be read
     */
    Optional<FunctionFeatures> extract(CodeEntity entity);
}
