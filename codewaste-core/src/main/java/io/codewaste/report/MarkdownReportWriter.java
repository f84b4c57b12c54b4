package io.codewaste.report;

import io.codewaste.CodeEntity;
import io.codewaste.findings.DiagnosticReport;
import io.codewaste.findings.DiagnosticSummary;
import io.codewaste.findings.Finding;
import io.codewaste.history.RunHistory;
import io.codewaste.history.RunTrend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a diagnostic report as a human-readable Markdown document.
 */
public class MarkdownReportWriter {

    static final int MAX_FINDINGS = 20;

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    public void write(DiagnosticReport report, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, render(report), StandardCharsets.UTF_8);
    }

    public String render(DiagnosticReport report) {
        DiagnosticSummary summary = report.summary();
        String currency = report.options().currency();
        Map<String, CodeEntity> entities = report.analysis().entities().stream()
            .collect(Collectors.toMap(CodeEntity::id, Function.identity(), (first, second) -> first));

        String costText = summary.estimatedAnnualizedAvoidableRuntimeCost() > 0
            ? money(summary.estimatedAnnualizedAvoidableRuntimeCost(), currency)
            : "Not calculated (set --cost-per-invocation to enable)";

        List<String> lines = new ArrayList<>();
        lines.add("# Software Intelligence Waste Diagnostic");
        lines.add("");

        // ===== Scope =====
        lines.add("## Scope");
        lines.add("- Repository: `" + report.repository() + "`");
        lines.add("- Generated at: `" + TIMESTAMP.format(report.generatedAt()) + "`");
        lines.add("- Runtime window: `" + report.options().timeWindowDays() + "` days");
        lines.add("");

        // ===== Summary =====
        lines.add("## Executive Truth Summary");
        lines.add("- Functions scanned: **" + summary.functionsScanned() + "**");
        lines.add("- Probable AI-generated functions: **" + summary.probableAiFunctions() + "**");
        lines.add("- High-confidence duplicate pairs: **" + summary.highConfidenceDuplicationPairs() + "**");
        lines.add("- Probable AI functions with zero runtime invocations: **" + summary.probableAiZeroInvocations() + "**");
        lines.add("- Git provenance coverage: **" + summary.gitEvidenceAvailable() + "**");
        lines.add("- Estimated annualized avoidable runtime cost: **" + costText + "**");
        lines.add("");

        // ===== Trend =====
        RunHistory history = report.history();
        if (history != null && history.trend() != null && history.previousScannedAt() != null) {
            RunTrend trend = history.trend();
            lines.add("## Trend vs Previous Run");
            lines.add("- Previous run: `" + history.previousScannedAt() + "`");
            lines.add("- Functions scanned delta: **" + signed(trend.functionsScannedDelta()) + "**");
            lines.add("- Probable AI functions delta: **" + signed(trend.probableAiFunctionsDelta()) + "**");
            lines.add("- High-confidence duplicate pairs delta: **"
                + signed(trend.highConfidenceDuplicationPairsDelta()) + "**");
            lines.add("- Runtime zero-invocation delta: **" + signed(trend.runtimeZeroInvocationsDelta()) + "**");
            lines.add("- Estimated annualized avoidable runtime cost delta: **"
                + money(trend.estimatedAnnualizedAvoidableRuntimeCostDelta(), currency) + "**");
            lines.add("");
        }

        // ===== Taxonomy =====
        lines.add("## Waste Taxonomy Mapping");
        lines.add("| Category | Instances | Economic signal |");
        lines.add("| --- | ---: | --- |");
        lines.add("| Structural duplication | " + summary.highConfidenceDuplicationPairs()
            + " | Consolidation may reduce repeated execution and maintenance. |");
        lines.add("| Runtime unused paths | " + summary.runtimeZeroInvocations()
            + " | Unused paths carry maintenance burden without runtime value. |");
        lines.add("| Probable AI + runtime unused | " + summary.probableAiZeroInvocations()
            + " | Candidate area for delete/consolidate review. |");
        lines.add("| Runtime ambiguity | " + summary.runtimeUnknown()
            + " | No decision without mapped runtime evidence. |");
        lines.add("");

        // ===== Findings =====
        lines.add("## Evidence Snapshots");
        List<Finding> findings = report.findings();
        if (findings.isEmpty()) {
            lines.add("- No high-confidence findings met report thresholds.");
        } else {
            int index = 1;
            for (Finding finding : findings.subList(0, Math.min(MAX_FINDINGS, findings.size()))) {
                lines.add(index++ + ". **" + finding.title() + "**");
                lines.add("   - Type: `" + finding.type().label() + "`");
                lines.add("   - Severity: `" + finding.severity().label() + "`");
                if (!finding.entityIds().isEmpty()) {
                    lines.add("   - Entities: " + finding.entityIds().stream()
                        .map(id -> "`" + reference(entities, id) + "`")
                        .collect(Collectors.joining(", ")));
                }
                if (!finding.evidence().isEmpty()) {
                    lines.add("   - Evidence: " + String.join("; ", finding.evidence()));
                }
                if (finding.estimatedAnnualCost() != null) {
                    lines.add("   - Estimated annual cost: " + money(finding.estimatedAnnualCost(), currency));
                }
            }
        }
        lines.add("");

        lines.add("## Method Constraints");
        lines.add("- Diagnostic only: no code mutation, no auto-refactor.");
        lines.add("- AI provenance is heuristic probability, not authorship proof.");
        lines.add("- Runtime mapping is best-effort; ambiguous mappings stay unresolved.");

        return String.join("\n", lines) + "\n";
    }

    private static String reference(Map<String, CodeEntity> entities, String id) {
        CodeEntity entity = entities.get(id);
        return entity == null ? id : entity.location();
    }

    static String signed(int value) {
        return String.format(Locale.ROOT, "%+d", value);
    }

    static String money(double value, String currency) {
        return String.format(Locale.ROOT, "%s %,.2f", currency, value);
    }
}
