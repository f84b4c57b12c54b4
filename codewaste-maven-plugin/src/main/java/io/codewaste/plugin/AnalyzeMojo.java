package io.codewaste.plugin;

import io.codewaste.AnalysisConfig;
import io.codewaste.ConfigurationException;
import io.codewaste.findings.DiagnosticOptions;
import io.codewaste.findings.DiagnosticReport;
import io.codewaste.findings.DiagnosticSummary;
import io.codewaste.findings.WasteDiagnostic;
import io.codewaste.history.RunHistoryException;
import io.codewaste.report.JsonReportWriter;
import io.codewaste.report.MarkdownReportWriter;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.*;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the code waste diagnostic over the project directory.
 *
 * <p>Usage: {@code mvn codewaste:analyze}</p>
 */
@Mojo(
    name = "analyze",
    defaultPhase = LifecyclePhase.VERIFY,
    threadSafe = true
)
public class AnalyzeMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    private MavenProject project;

    /**
     * Directory to scan.
     */
    @Parameter(property = "codewaste.sourceDirectory", defaultValue = "${project.basedir}")
    private File sourceDirectory;

    /**
     * Output directory for the Markdown and JSON reports.
     */
    @Parameter(property = "codewaste.outputDirectory", defaultValue = "${project.build.directory}/codewaste")
    private File outputDirectory;

    /**
     * Runtime evidence JSON file.
     */
    @Parameter(property = "codewaste.runtime")
    private File runtime;

    @Parameter(property = "codewaste.timeWindowDays", defaultValue = "90")
    private int timeWindowDays;

    @Parameter(property = "codewaste.costPerInvocation", defaultValue = "0")
    private double costPerInvocation;

    @Parameter(property = "codewaste.currency", defaultValue = "USD")
    private String currency;

    /**
     * SQLite database recording runs; enables the trend section when set.
     */
    @Parameter(property = "codewaste.historyDb")
    private File historyDb;

    /**
     * Minimum AI probability to report.
     */
    @Parameter(property = "codewaste.aiThreshold", defaultValue = "0.65")
    private double aiThreshold;

    /**
     * High-confidence duplication threshold.
     */
    @Parameter(property = "codewaste.dupThreshold", defaultValue = "0.9")
    private double dupThreshold;

    @Parameter(property = "codewaste.mediumThreshold", defaultValue = "0.75")
    private double mediumThreshold;

    @Parameter(property = "codewaste.includeMedium", defaultValue = "false")
    private boolean includeMedium;

    @Parameter(property = "codewaste.minDupBodyStatements", defaultValue = "3")
    private int minDupBodyStatements;

    @Parameter(property = "codewaste.minDupSignatureChars", defaultValue = "0")
    private int minDupSignatureChars;

    @Parameter(property = "codewaste.includeTests", defaultValue = "false")
    private boolean includeTests;

    /**
     * Whether git blame evidence adjusts provenance scores.
     */
    @Parameter(property = "codewaste.git", defaultValue = "true")
    private boolean git;

    /**
     * Skip the diagnostic.
     */
    @Parameter(property = "codewaste.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Skipping code waste diagnostic");
            return;
        }

        getLog().info("Analyzing " + project.getArtifactId() + " in " + sourceDirectory);

        AnalysisConfig config = AnalysisConfig.defaults()
            .withIncludeTests(includeTests)
            .withHighThreshold(dupThreshold)
            .withMinBodyStatements(minDupBodyStatements)
            .withMinSignatureChars(minDupSignatureChars)
            .withProvenanceThreshold(aiThreshold)
            .withGitEvidence(git);
        if (includeMedium) {
            config = config.withMediumTier(mediumThreshold);
        }
        DiagnosticOptions options = DiagnosticOptions.defaults()
            .withRuntimePath(runtime != null ? runtime.toPath() : null)
            .withTimeWindowDays(timeWindowDays)
            .withCostPerInvocation(costPerInvocation)
            .withCurrency(currency)
            .withHistoryPath(historyDb != null ? historyDb.toPath() : null);

        DiagnosticReport report;
        try {
            report = new WasteDiagnostic().run(sourceDirectory.toPath(), config, options);
        } catch (ConfigurationException e) {
            throw new MojoFailureException("Invalid codewaste configuration: " + e.getMessage(), e);
        } catch (RunHistoryException e) {
            throw new MojoExecutionException("Failed to record codewaste run history", e);
        }

        Path markdown = outputDirectory.toPath().resolve("diagnostic.md");
        Path json = outputDirectory.toPath().resolve("diagnostic.json");
        try {
            new MarkdownReportWriter().write(report, markdown);
            new JsonReportWriter().write(report, json);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to write codewaste reports", e);
        }

        DiagnosticSummary summary = report.summary();
        getLog().info("Functions scanned: " + summary.functionsScanned());
        getLog().info("Probable AI functions: " + summary.probableAiFunctions());
        getLog().info("High-confidence duplicate pairs: " + summary.highConfidenceDuplicationPairs());
        getLog().info("Probable AI + zero invocations: " + summary.probableAiZeroInvocations());
        getLog().info("Reports written to: " + outputDirectory);
    }
}
