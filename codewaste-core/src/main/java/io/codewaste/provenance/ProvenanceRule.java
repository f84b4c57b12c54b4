package io.codewaste.provenance;

import java.util.List;
import java.util.function.Predicate;

/**
 * One additive scoring rule: a label, a weight and the condition that earns it.
 */
public record ProvenanceRule(String label, double weight, Predicate<FunctionFeatures> condition) {

    /** Rules in evaluation order; labels are reported in this order. */
    public static final List<ProvenanceRule> RULES = List.of(
        new ProvenanceRule("uniform guard clauses", 0.25,
            f -> f.guardClauseCount() >= 3),
        new ProvenanceRule("generic variable naming", 0.20,
            f -> f.genericNameRatio() >= 0.6),
        new ProvenanceRule("high defensive branch density", 0.20,
            f -> f.defensiveDensity() >= 0.4 && f.statementCount() >= 4),
        new ProvenanceRule("repetitive error messaging", 0.15,
            FunctionFeatures::repetitiveErrors),
        new ProvenanceRule("generic return pipeline", 0.15,
            FunctionFeatures::returnsGenericName),
        new ProvenanceRule("long boilerplate flow", 0.10,
            f -> f.statementCount() >= 12 && !f.hasLoopOrTry())
    );

    public boolean matches(FunctionFeatures features) {
        return condition.test(features);
    }
}
