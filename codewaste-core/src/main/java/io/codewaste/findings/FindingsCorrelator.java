package io.codewaste.findings;

import io.codewaste.AnalysisResult;
import io.codewaste.CodeEntity;
import io.codewaste.Confidence;
import io.codewaste.DuplicationPair;
import io.codewaste.ProvenanceSignal;
import io.codewaste.runtime.RuntimeEvidence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cross-references provenance, duplication and runtime evidence into findings.
 *
 * <p>Per-entity findings come first, in entity order, followed by one
 * consolidation finding per qualifying duplication pair.</p>
 */
public class FindingsCorrelator {

    private static final double DAYS_PER_YEAR = 365.0;

    private final DiagnosticOptions options;

    public FindingsCorrelator(DiagnosticOptions options) {
        this.options = options;
    }

    public record Correlation(List<Finding> findings, DiagnosticSummary summary) {
    }

    public Correlation correlate(AnalysisResult analysis, Map<String, RuntimeEvidence> runtime) {
        Map<String, ProvenanceSignal> signals = analysis.signals().stream()
            .collect(Collectors.toMap(ProvenanceSignal::entityId, Function.identity(), (first, second) -> first));
        Set<String> duplicated = new HashSet<>();
        for (DuplicationPair pair : analysis.duplicationPairs()) {
            duplicated.add(pair.entityA());
            duplicated.add(pair.entityB());
        }

        List<Finding> findings = new ArrayList<>();
        int runtimeZero = 0;
        int runtimeUnknown = 0;
        int aiZero = 0;

        for (CodeEntity entity : analysis.entities()) {
            RuntimeEvidence evidence = runtime.get(entity.id());
            ProvenanceSignal signal = signals.get(entity.id());
            boolean zero = evidence != null && evidence.zeroInvocations();

            if (zero) {
                runtimeZero++;
                if (signal != null) {
                    aiZero++;
                    findings.add(Finding.of(FindingType.RUNTIME_UNUSED_REVIEW, List.of(entity.id()), List.of(
                        "ai_probability=" + signal.probability(),
                        "runtime_invocations=0",
                        "confidence=" + signal.confidence().label())));
                }
            }
            if (evidence == null || evidence.invocationCount() == null) {
                runtimeUnknown++;
            }
            if (signal != null && signal.confidence() == Confidence.HIGH && zero && duplicated.contains(entity.id())) {
                findings.add(Finding.of(FindingType.DELETE_CANDIDATE_REVIEW, List.of(entity.id()), List.of(
                    "ai_probability=" + signal.probability(),
                    "runtime_invocations=0",
                    "high_semantic_overlap=true")));
            }
        }

        double annualCostTotal = 0.0;
        for (DuplicationPair pair : analysis.duplicationPairs()) {
            RuntimeEvidence a = runtime.get(pair.entityA());
            RuntimeEvidence b = runtime.get(pair.entityB());
            if (a == null || b == null || !a.invoked() || !b.invoked()) {
                continue;
            }
            Double annualCost = null;
            if (options.costPerInvocation() > 0) {
                int duplicateInvocations = Math.min(a.invocationCount(), b.invocationCount());
                annualCost = annualCost(duplicateInvocations);
                annualCostTotal += annualCost;
            }
            findings.add(Finding.of(FindingType.CONSOLIDATION_CANDIDATE_REVIEW,
                List.of(pair.entityA(), pair.entityB()),
                List.of(
                    "semantic_overlap=" + pair.similarity(),
                    "invocations_a=" + a.invocationCount(),
                    "invocations_b=" + b.invocationCount()),
                annualCost));
        }

        int highConfidenceAi = (int) analysis.signals().stream()
            .filter(signal -> signal.confidence() == Confidence.HIGH)
            .count();

        DiagnosticSummary summary = new DiagnosticSummary(
            analysis.entities().size(),
            analysis.signals().size(),
            highConfidenceAi,
            analysis.duplicationPairs().size(),
            runtimeZero,
            runtimeUnknown,
            aiZero,
            (int) analysis.gitEvidenceAvailableCount(),
            roundCents(annualCostTotal));
        return new Correlation(findings, summary);
    }

    /**
     * {@code invocations * costPerInvocation}, scaled from the observation window to a year.
     */
    double annualCost(int invocations) {
        double annualization = DAYS_PER_YEAR / Math.max(options.timeWindowDays(), 1);
        return roundCents(invocations * options.costPerInvocation() * annualization);
    }

    private static double roundCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
