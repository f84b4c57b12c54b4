package io.codewaste.findings;

import io.codewaste.AnalysisResult;
import io.codewaste.CodeEntity;
import io.codewaste.ConfigurationException;
import io.codewaste.Confidence;
import io.codewaste.DuplicationPair;
import io.codewaste.GitEvidence;
import io.codewaste.ProvenanceSignal;
import io.codewaste.runtime.RuntimeEvidence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FindingsCorrelatorTest {

    private final CodeEntity first = CodeEntity.of("orders.js", "first", "orders.first", 1, 10, "");
    private final CodeEntity second = CodeEntity.of("orders.js", "second", "orders.second", 12, 20, "");
    private final CodeEntity third = CodeEntity.of("orders.js", "third", "orders.third", 22, 30, "");

    private final List<CodeEntity> entities = List.of(first, second, third);
    private final DuplicationPair pair = new DuplicationPair(first.id(), second.id(), 0.95, Confidence.HIGH);

    private static RuntimeEvidence runtime(CodeEntity entity, Integer invocations) {
        return new RuntimeEvidence(entity.id(), invocations, null,
            invocations == null ? RuntimeEvidence.SOURCE_UNMAPPED : RuntimeEvidence.SOURCE_FILE);
    }

    // ==================== Finding Tests ====================

    @Test
    void testZeroInvocationFindings() {
        AnalysisResult analysis = new AnalysisResult(entities,
            List.of(ProvenanceSignal.of(first.id(), 0.9, List.of("uniform guard clauses")),
                ProvenanceSignal.of(second.id(), 0.7, List.of("generic variable naming"))),
            List.of(pair), Map.of());
        Map<String, RuntimeEvidence> runtime = Map.of(
            first.id(), runtime(first, 0),
            second.id(), runtime(second, 0),
            third.id(), runtime(third, null));

        FindingsCorrelator.Correlation correlation =
            new FindingsCorrelator(DiagnosticOptions.defaults()).correlate(analysis, runtime);

        List<Finding> findings = correlation.findings();
        assertEquals(3, findings.size());

        assertEquals(FindingType.RUNTIME_UNUSED_REVIEW, findings.get(0).type());
        assertEquals(List.of(first.id()), findings.get(0).entityIds());
        assertEquals(List.of("ai_probability=0.9", "runtime_invocations=0", "confidence=high"),
            findings.get(0).evidence());
        assertEquals(Severity.LOW, findings.get(0).severity());

        assertEquals(FindingType.DELETE_CANDIDATE_REVIEW, findings.get(1).type());
        assertEquals(List.of("ai_probability=0.9", "runtime_invocations=0", "high_semantic_overlap=true"),
            findings.get(1).evidence());

        assertEquals(FindingType.RUNTIME_UNUSED_REVIEW, findings.get(2).type());
        assertEquals(List.of(second.id()), findings.get(2).entityIds());
        assertTrue(findings.get(2).evidence().contains("confidence=medium"));

        DiagnosticSummary summary = correlation.summary();
        assertEquals(3, summary.functionsScanned());
        assertEquals(2, summary.probableAiFunctions());
        assertEquals(1, summary.highConfidenceAiFunctions());
        assertEquals(1, summary.highConfidenceDuplicationPairs());
        assertEquals(2, summary.runtimeZeroInvocations());
        assertEquals(1, summary.runtimeUnknown());
        assertEquals(2, summary.probableAiZeroInvocations());
        assertEquals(0.0, summary.estimatedAnnualizedAvoidableRuntimeCost());
    }

    @Test
    void testConsolidationRequiresBothSidesInvoked() {
        AnalysisResult analysis = new AnalysisResult(entities, List.of(), List.of(pair), Map.of());
        DiagnosticOptions options = DiagnosticOptions.defaults().withCostPerInvocation(0.0005);

        List<Finding> oneSided = new FindingsCorrelator(options).correlate(analysis,
            Map.of(first.id(), runtime(first, 10), second.id(), runtime(second, 0))).findings();
        assertTrue(oneSided.isEmpty());

        FindingsCorrelator.Correlation correlation = new FindingsCorrelator(options).correlate(analysis,
            Map.of(first.id(), runtime(first, 1200), second.id(), runtime(second, 800)));

        assertEquals(1, correlation.findings().size());
        Finding finding = correlation.findings().get(0);
        assertEquals(FindingType.CONSOLIDATION_CANDIDATE_REVIEW, finding.type());
        assertEquals(Severity.MEDIUM, finding.severity());
        assertEquals(List.of(first.id(), second.id()), finding.entityIds());
        assertEquals(List.of("semantic_overlap=0.95", "invocations_a=1200", "invocations_b=800"), finding.evidence());
        assertEquals(1.62, finding.estimatedAnnualCost());
        assertEquals(1.62, correlation.summary().estimatedAnnualizedAvoidableRuntimeCost());
    }

    @Test
    void testNoCostWithoutCostPerInvocation() {
        AnalysisResult analysis = new AnalysisResult(entities, List.of(), List.of(pair), Map.of());

        Finding finding = new FindingsCorrelator(DiagnosticOptions.defaults()).correlate(analysis,
            Map.of(first.id(), runtime(first, 5), second.id(), runtime(second, 6))).findings().get(0);

        assertNull(finding.estimatedAnnualCost());
    }

    @Test
    void testGitCoverageCounted() {
        AnalysisResult analysis = new AnalysisResult(entities, List.of(), List.of(), Map.of(
            first.id(), new GitEvidence(first.id(), true, 1, 1, 1.0, 3, 1, 1),
            second.id(), GitEvidence.unavailable(second.id(), 0, 0)));

        DiagnosticSummary summary = new FindingsCorrelator(DiagnosticOptions.defaults())
            .correlate(analysis, Map.of()).summary();

        assertEquals(1, summary.gitEvidenceAvailable());
        assertEquals(3, summary.runtimeUnknown());
        assertEquals(0, summary.runtimeZeroInvocations());
    }

    // ==================== Cost Tests ====================

    @Test
    void testAnnualCost() {
        DiagnosticOptions options = DiagnosticOptions.defaults().withCostPerInvocation(0.01).withTimeWindowDays(365);
        assertEquals(10.0, new FindingsCorrelator(options).annualCost(1000));

        DiagnosticOptions zeroWindow = options.withTimeWindowDays(0);
        assertEquals(3650.0, new FindingsCorrelator(zeroWindow).annualCost(1000));
    }

    // ==================== Options Tests ====================

    @Test
    void testOptionsValidation() {
        assertDoesNotThrow(() -> {
            DiagnosticOptions.defaults().validate();
        });
        assertThrows(ConfigurationException.class,
            () -> DiagnosticOptions.defaults().withTimeWindowDays(-1).validate());
        assertThrows(ConfigurationException.class,
            () -> DiagnosticOptions.defaults().withCostPerInvocation(-0.1).validate());
        assertThrows(ConfigurationException.class,
            () -> DiagnosticOptions.defaults().withCostPerInvocation(Double.NaN).validate());
        assertThrows(ConfigurationException.class,
            () -> DiagnosticOptions.defaults().withCurrency(" ").validate());
    }
}
