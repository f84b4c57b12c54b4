package io.codewaste.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.codewaste.findings.DiagnosticReport;
import io.codewaste.findings.DiagnosticOptions;
import io.codewaste.history.RunHistory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a diagnostic report as JSON with snake_case keys.
 *
 * <p>Top-level sections: {@code meta}, {@code summary}, {@code entities},
 * {@code ai_signals}, {@code duplication_pairs}, {@code git_evidence},
 * {@code runtime_evidence}, {@code findings} and {@code trend}. The trend
 * holds the deltas against the previous recorded run and is null unless run
 * history is enabled and an earlier run of the repository exists.</p>
 */
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public JsonNode toTree(DiagnosticReport report) {
        return objectMapper.valueToTree(payload(report));
    }

    public String toJson(DiagnosticReport report) throws IOException {
        return objectMapper.writeValueAsString(payload(report));
    }

    public void write(DiagnosticReport report, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, toJson(report) + "\n", StandardCharsets.UTF_8);
    }

    private Map<String, Object> payload(DiagnosticReport report) {
        DiagnosticOptions options = report.options();
        RunHistory history = report.history();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("repository", report.repository().toString());
        meta.put("generated_at", report.generatedAt().toString());
        meta.put("time_window_days", options.timeWindowDays());
        meta.put("cost_per_invocation", options.costPerInvocation());
        meta.put("currency", options.currency());
        meta.put("runtime_file", options.runtimePath() == null ? null : options.runtimePath().toString());
        meta.put("config", report.config());
        meta.put("run_id", history == null ? null : history.runId());
        meta.put("previous_run_id", history == null ? null : history.previousRunId());
        meta.put("previous_scanned_at", history == null ? null : history.previousScannedAt());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("meta", meta);
        payload.put("summary", report.summary());
        payload.put("entities", report.analysis().entities());
        payload.put("ai_signals", report.analysis().signals());
        payload.put("duplication_pairs", report.analysis().duplicationPairs());
        payload.put("git_evidence", report.analysis().gitEvidence());
        payload.put("runtime_evidence", report.runtimeEvidence());
        payload.put("findings", report.findings());
        payload.put("trend", history == null ? null : history.trend());
        return payload;
    }
}
