package io.codewaste.findings;

import io.codewaste.AnalysisConfig;
import io.codewaste.AnalysisResult;
import io.codewaste.CodeAnalyzer;
import io.codewaste.history.RunHistoryStore;
import io.codewaste.runtime.RuntimeEvidence;
import io.codewaste.runtime.RuntimeEvidenceLoader;
import io.codewaste.runtime.RuntimeEvidenceMapper;
import io.codewaste.runtime.RuntimeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Runs analysis, maps runtime evidence and correlates both into a report.
 */
public class WasteDiagnostic {

    private static final Logger log = LoggerFactory.getLogger(WasteDiagnostic.class);

    private final CodeAnalyzer analyzer;
    private final RuntimeEvidenceLoader runtimeLoader;
    private final Clock clock;

    public WasteDiagnostic() {
        this(new CodeAnalyzer(), new RuntimeEvidenceLoader(), Clock.systemUTC());
    }

    public WasteDiagnostic(CodeAnalyzer analyzer, RuntimeEvidenceLoader runtimeLoader, Clock clock) {
        this.analyzer = analyzer;
        this.runtimeLoader = runtimeLoader;
        this.clock = clock;
    }

    /**
     * @throws io.codewaste.ConfigurationException for invalid options, a missing
     *         root or an unusable runtime evidence file; raised before scanning
     * @throws io.codewaste.history.RunHistoryException if the history database
     *         cannot be written
     */
    public DiagnosticReport run(Path root, AnalysisConfig config, DiagnosticOptions options) {
        config.validate();
        options.validate();
        Map<String, RuntimeRecord> runtimeIndex = runtimeLoader.load(options.runtimePath());

        AnalysisResult analysis = analyzer.analyze(root, config);
        Map<String, RuntimeEvidence> runtime = RuntimeEvidenceMapper.map(analysis.entities(), runtimeIndex);
        FindingsCorrelator.Correlation correlation = new FindingsCorrelator(options).correlate(analysis, runtime);

        log.info("Diagnostic for {}: {} findings", root, correlation.findings().size());
        DiagnosticReport report = new DiagnosticReport(root.toAbsolutePath().normalize(), clock.instant(),
            config, options, analysis, runtime, correlation.findings(), correlation.summary(), null);
        if (options.historyPath() == null) {
            return report;
        }
        return report.withHistory(new RunHistoryStore(options.historyPath(), clock).record(report));
    }
}
