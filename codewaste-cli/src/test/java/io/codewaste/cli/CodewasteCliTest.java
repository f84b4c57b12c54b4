package io.codewaste.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CodewasteCliTest {

    private static final String ORDERS = """
        function validateOrderPayload(payload) {
          if (payload == null) {
            throw new Error("invalid payload");
          }
          if (!payload.orderId) {
            throw new Error("invalid payload");
          }
          if (!payload.items) {
            throw new Error("invalid payload");
          }

          const data = payload;
          const result = {};
          result.orderId = data.orderId;
          result.itemCount = data.items.length;
          return result;
        }

        const validateOrderRequest = (data) => {
          if (data == null) {
            throw new Error("invalid payload");
          }
          if (!data.orderId) {
            throw new Error("invalid payload");
          }
          if (!data.items) {
            throw new Error("invalid payload");
          }

          const input = data;
          const response = {};
          response.orderId = input.orderId;
          response.itemCount = input.items.length;
          return response;
        };

        function helper(flag) {
          if (flag) {
            return true;
          }
          return false;
        }
        """;

    @TempDir
    Path tempDir;

    private Path repo;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() throws IOException {
        repo = Files.createDirectories(tempDir.resolve("repo"));
        Files.writeString(repo.resolve("orders.js"), ORDERS);

        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new CodewasteCli());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    // ==================== Analyze Tests ====================

    @Test
    void testAnalyzeWritesReports() throws IOException {
        Path runtime = tempDir.resolve("runtime.json");
        Files.writeString(runtime, "{\"functions\": {\"validateOrderPayload\": 40, \"validateOrderRequest\": 25, \"helper\": 0}}");
        Path markdown = tempDir.resolve("out/diagnostic.md");
        Path json = tempDir.resolve("out/diagnostic.json");

        int exitCode = cli.execute("analyze", repo.toString(), "--no-git",
            "--runtime", runtime.toString(),
            "--cost-per-invocation", "0.01",
            "-o", markdown.toString(),
            "--json-output", json.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.readString(markdown).contains("## Evidence Snapshots"));
        assertTrue(Files.readString(json).contains("\"consolidation_candidate_review\""));
        assertTrue(out.toString().contains("Functions scanned: 3"));
        assertTrue(out.toString().contains("High-confidence duplicate pairs: 1"));
        assertTrue(out.toString().contains("Report written: " + markdown.toAbsolutePath()));
    }

    @Test
    void testAnalyzeWithHistoryDatabase() throws IOException {
        Path history = tempDir.resolve("state/history.db");
        Path markdown = tempDir.resolve("out/diagnostic.md");

        int first = cli.execute("analyze", repo.toString(), "--no-git",
            "--history-db", history.toString(), "-o", markdown.toString());
        assertEquals(0, first, err.toString());
        assertFalse(out.toString().contains("Functions scanned delta"));
        assertFalse(Files.readString(markdown).contains("## Trend vs Previous Run"));

        int second = cli.execute("analyze", repo.toString(), "--no-git",
            "--history-db", history.toString(), "-o", markdown.toString());
        assertEquals(0, second, err.toString());
        assertTrue(Files.exists(history));
        assertTrue(out.toString().contains("Functions scanned delta since "));
        assertTrue(out.toString().contains(": +0"));
        assertTrue(Files.readString(markdown).contains("- Functions scanned delta: **+0**"));
    }

    @Test
    void testAnalyzeMissingRepository() {
        int exitCode = cli.execute("analyze", tempDir.resolve("missing").toString(), "--no-git",
            "-o", tempDir.resolve("r.md").toString());

        assertEquals(CodewasteCli.EXIT_CONFIGURATION, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
        assertFalse(Files.exists(tempDir.resolve("r.md")));
    }

    @Test
    void testAnalyzeMissingRuntimeFile() {
        int exitCode = cli.execute("analyze", repo.toString(), "--no-git",
            "--runtime", tempDir.resolve("none.json").toString(),
            "-o", tempDir.resolve("r.md").toString());

        assertEquals(CodewasteCli.EXIT_CONFIGURATION, exitCode);
        assertTrue(err.toString().contains("Runtime evidence file not found"));
    }

    @Test
    void testInvalidThresholdRejected() {
        int exitCode = cli.execute("duplicates", repo.toString(), "--no-git", "--dup-threshold", "1.5");

        assertEquals(CodewasteCli.EXIT_CONFIGURATION, exitCode);
        assertTrue(err.toString().contains("highThreshold"));
    }

    // ==================== Listing Tests ====================

    @Test
    void testDuplicates() {
        int exitCode = cli.execute("duplicates", repo.toString(), "--no-git");

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("Found 1 duplication pairs:"));
        assertTrue(output.contains("orders.validateOrderPayload (orders.js:1)"));
        assertTrue(output.contains("orders.validateOrderRequest (orders.js:19)"));
    }

    @Test
    void testProvenance() {
        int exitCode = cli.execute("provenance", repo.toString(), "--no-git");

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("Found 2 provenance signals:"));
        assertTrue(output.contains("+ uniform guard clauses"));
        assertFalse(output.contains("orders.helper"));
    }

    @Test
    void testProvenanceThresholdOption() {
        int exitCode = cli.execute("provenance", repo.toString(), "--no-git", "--ai-threshold", "0.9");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Found 0 provenance signals:"));
    }
}
