package io.codewaste;

import io.codewaste.duplication.DuplicationDetector;
import io.codewaste.git.GitEvidenceCollector;
import io.codewaste.provenance.ProvenanceScorer;
import io.codewaste.scanner.RepositoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs one static analysis of a repository.
 *
 * <pre>{@code
 * AnalysisResult result = new CodeAnalyzer().analyze(Path.of("."), AnalysisConfig.defaults());
 * }</pre>
 *
 * <p>Scanning, git collection, scoring and duplication detection run in that
 * order on the calling thread. Identical inputs give identical output.</p>
 */
public class CodeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CodeAnalyzer.class);

    private final RepositoryScanner scanner;
    private final GitEvidenceCollector gitCollector;
    private final ProvenanceScorer scorer;

    public CodeAnalyzer() {
        this(new RepositoryScanner(), new GitEvidenceCollector(), new ProvenanceScorer());
    }

    public CodeAnalyzer(RepositoryScanner scanner, GitEvidenceCollector gitCollector, ProvenanceScorer scorer) {
        this.scanner = scanner;
        this.gitCollector = gitCollector;
        this.scorer = scorer;
    }

    /**
     * Analyzes the repository at {@code root}.
     *
     * @throws ConfigurationException if the configuration is invalid or the
     *                                root is not an existing directory
     */
    public AnalysisResult analyze(Path root, AnalysisConfig config) {
        config.validate();
        if (root == null || !Files.isDirectory(root)) {
            throw new ConfigurationException("Repository root does not exist or is not a directory: " + root);
        }

        List<CodeEntity> entities = scanner.scan(root, config.includeTests());
        Map<String, GitEvidence> gitEvidence = config.gitEvidenceEnabled()
            ? gitCollector.collect(root, entities)
            : Map.of();
        List<ProvenanceSignal> signals = scorer.score(entities, config.provenanceThreshold(), gitEvidence);
        List<DuplicationPair> pairs = new DuplicationDetector(config).detect(entities);

        log.info("Analyzed {}: {} functions, {} provenance signals, {} duplication pairs",
            root, entities.size(), signals.size(), pairs.size());
        return new AnalysisResult(entities, signals, pairs, gitEvidence);
    }
}
