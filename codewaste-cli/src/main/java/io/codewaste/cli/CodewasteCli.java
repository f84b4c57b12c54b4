package io.codewaste.cli;

import io.codewaste.AnalysisConfig;
import io.codewaste.AnalysisResult;
import io.codewaste.CodeAnalyzer;
import io.codewaste.CodeEntity;
import io.codewaste.ConfigurationException;
import io.codewaste.DuplicationPair;
import io.codewaste.ProvenanceSignal;
import io.codewaste.findings.DiagnosticOptions;
import io.codewaste.findings.DiagnosticReport;
import io.codewaste.findings.DiagnosticSummary;
import io.codewaste.findings.WasteDiagnostic;
import io.codewaste.history.RunHistory;
import io.codewaste.history.RunHistoryException;
import io.codewaste.report.JsonReportWriter;
import io.codewaste.report.MarkdownReportWriter;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line interface for codewaste.
 */
@Command(
    name = "codewaste",
    mixinStandardHelpOptions = true,
    version = "codewaste 1.0.0",
    description = "Read-only diagnostic analyzer for AI code waste signals",
    subcommands = {
        CodewasteCli.AnalyzeCommand.class,
        CodewasteCli.DuplicatesCommand.class,
        CodewasteCli.ProvenanceCommand.class
    }
)
public class CodewasteCli implements Callable<Integer> {

    /** Exit status for unusable options, a missing repository or a bad runtime file. */
    public static final int EXIT_CONFIGURATION = 2;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodewasteCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Options shared by every analysis command.
     */
    static class AnalysisOptions {

        @Parameters(index = "0", arity = "0..1", description = "Repository path (default: current directory)",
            defaultValue = ".")
        Path repo;

        @Option(names = {"--ai-threshold"}, description = "Minimum AI probability to report", defaultValue = "0.65")
        double aiThreshold;

        @Option(names = {"--dup-threshold"}, description = "High-confidence duplication threshold", defaultValue = "0.9")
        double dupThreshold;

        @Option(names = {"--medium-threshold"}, description = "Medium-confidence duplication threshold",
            defaultValue = "0.75")
        double mediumThreshold;

        @Option(names = {"--include-medium"}, description = "Also report medium-confidence duplication pairs")
        boolean includeMedium;

        @Option(names = {"--min-dup-body-statements"}, description = "Minimum body statements for duplication",
            defaultValue = "3")
        int minBodyStatements;

        @Option(names = {"--min-dup-signature-chars"}, description = "Minimum canonical signature length (0 disables)",
            defaultValue = "0")
        int minSignatureChars;

        @Option(names = {"--include-tests"}, description = "Include directories named 'tests'")
        boolean includeTests;

        @Option(names = {"--no-git"}, description = "Skip git blame evidence")
        boolean noGit;

        AnalysisConfig toConfig() {
            AnalysisConfig config = AnalysisConfig.defaults()
                .withIncludeTests(includeTests)
                .withHighThreshold(dupThreshold)
                .withMinBodyStatements(minBodyStatements)
                .withMinSignatureChars(minSignatureChars)
                .withProvenanceThreshold(aiThreshold)
                .withGitEvidence(!noGit);
            return includeMedium ? config.withMediumTier(mediumThreshold) : config;
        }
    }

    /**
     * Full diagnostic with reports.
     */
    @Command(
        name = "analyze",
        description = "Run the full diagnostic and write Markdown and JSON reports"
    )
    static class AnalyzeCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Mixin
        private AnalysisOptions analysis;

        @Option(names = {"--runtime"}, description = "Runtime evidence JSON file")
        private Path runtime;

        @Option(names = {"--time-window-days"}, description = "Days covered by the runtime evidence",
            defaultValue = "90")
        private int timeWindowDays;

        @Option(names = {"--cost-per-invocation"}, description = "Cost per invocation for annualized estimates",
            defaultValue = "0")
        private double costPerInvocation;

        @Option(names = {"--currency"}, description = "Currency label for cost output", defaultValue = "USD")
        private String currency;

        @Option(names = {"-o", "--output"}, description = "Markdown report path",
            defaultValue = "reports/diagnostic.md")
        private Path output;

        @Option(names = {"--json-output"}, description = "JSON report path")
        private Path jsonOutput;

        @Option(names = {"--history-db"}, description = "SQLite database recording runs for trend deltas")
        private Path historyDb;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            DiagnosticOptions options = DiagnosticOptions.defaults()
                .withRuntimePath(runtime)
                .withTimeWindowDays(timeWindowDays)
                .withCostPerInvocation(costPerInvocation)
                .withCurrency(currency)
                .withHistoryPath(historyDb);

            DiagnosticReport report;
            try {
                report = new WasteDiagnostic().run(analysis.repo, analysis.toConfig(), options);
            } catch (ConfigurationException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return EXIT_CONFIGURATION;
            } catch (RunHistoryException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return 1;
            }

            new MarkdownReportWriter().write(report, output);
            if (jsonOutput != null) {
                new JsonReportWriter().write(report, jsonOutput);
            }

            DiagnosticSummary summary = report.summary();
            out.println("Functions scanned: " + summary.functionsScanned());
            out.println("Probable AI functions: " + summary.probableAiFunctions());
            out.println("High-confidence duplicate pairs: " + summary.highConfidenceDuplicationPairs());
            out.println("Probable AI + zero invocations: " + summary.probableAiZeroInvocations());
            RunHistory history = report.history();
            if (history != null && history.trend() != null) {
                out.println("Functions scanned delta since " + history.previousScannedAt() + ": "
                    + String.format(Locale.ROOT, "%+d", history.trend().functionsScannedDelta()));
            }
            out.println("Report written: " + output.toAbsolutePath());
            if (jsonOutput != null) {
                out.println("JSON report written: " + jsonOutput.toAbsolutePath());
            }
            out.flush();
            return 0;
        }
    }

    /**
     * Print duplication pairs.
     */
    @Command(
        name = "duplicates",
        description = "Find structurally near-identical functions"
    )
    static class DuplicatesCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Mixin
        private AnalysisOptions analysis;

        @Override
        public Integer call() {
            AnalysisResult result;
            try {
                result = new CodeAnalyzer().analyze(analysis.repo, analysis.toConfig());
            } catch (ConfigurationException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return EXIT_CONFIGURATION;
            }

            PrintWriter out = spec.commandLine().getOut();
            out.println("Found " + result.duplicationPairs().size() + " duplication pairs:");
            out.println("=".repeat(60));
            for (DuplicationPair pair : result.duplicationPairs()) {
                out.println();
                out.printf("[%.3f %s]%n", pair.similarity(), pair.confidence().label());
                out.println("  - " + describe(result, pair.entityA()));
                out.println("  - " + describe(result, pair.entityB()));
            }
            out.flush();
            return 0;
        }
    }

    /**
     * Print provenance signals.
     */
    @Command(
        name = "provenance",
        description = "Score functions for probable machine-generated authorship"
    )
    static class ProvenanceCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Mixin
        private AnalysisOptions analysis;

        @Override
        public Integer call() {
            AnalysisResult result;
            try {
                result = new CodeAnalyzer().analyze(analysis.repo, analysis.toConfig());
            } catch (ConfigurationException e) {
                spec.commandLine().getErr().println("Error: " + e.getMessage());
                return EXIT_CONFIGURATION;
            }

            PrintWriter out = spec.commandLine().getOut();
            out.println("Found " + result.signals().size() + " provenance signals:");
            out.println("=".repeat(60));
            for (ProvenanceSignal signal : result.signals()) {
                out.println();
                out.printf("[%.2f %s] %s%n", signal.probability(), signal.confidence().label(),
                    describe(result, signal.entityId()));
                for (String label : signal.signals()) {
                    out.println("    + " + label);
                }
            }
            out.flush();
            return 0;
        }
    }

    private static String describe(AnalysisResult result, String entityId) {
        return result.entity(entityId)
            .map(CodewasteCli::describe)
            .orElse(entityId);
    }

    private static String describe(CodeEntity entity) {
        return entity.qualifiedName() + " (" + entity.location() + ")";
    }
}
