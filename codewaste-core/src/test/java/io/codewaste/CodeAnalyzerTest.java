package io.codewaste;

import io.codewaste.git.BlameLine;
import io.codewaste.git.CommitRef;
import io.codewaste.git.GitClient;
import io.codewaste.git.GitEvidenceCollector;
import io.codewaste.provenance.ProvenanceScorer;
import io.codewaste.scanner.RepositoryScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static io.codewaste.TestFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class CodeAnalyzerTest {

    @TempDir
    Path tempDir;

    private final AnalysisConfig noGit = AnalysisConfig.defaults().withGitEvidence(false);

    // ==================== Scenario Tests ====================

    @Test
    void testNearDuplicateScriptFunctions() throws IOException {
        Path repo = TestFixtures.copy("fixtures_js", tempDir.resolve("repo"));

        AnalysisResult result = new CodeAnalyzer().analyze(repo, noGit);

        assertEquals(3, result.entities().size());
        assertEquals(1, result.duplicationPairs().size());
        DuplicationPair pair = result.duplicationPairs().get(0);
        assertEquals(Confidence.HIGH, pair.confidence());
        assertEquals("validateOrderPayload", result.entity(pair.entityA()).orElseThrow().name());
        assertEquals("validateOrderRequest", result.entity(pair.entityB()).orElseThrow().name());
    }

    @Test
    void testShortRenamedScriptFunctionsPairAtDefaults() throws IOException {
        String pricing = """
            function totalFor(order) {
              const sum = order.price * order.quantity;
              const label = "total";
              console.log(label, sum);
              return sum;
            }

            function amountOf(cart) {
              const value = cart.price * cart.quantity;
              const tag = "amount";
              console.log(tag, value);
              return value;
            }
            """;
        write(tempDir, "src/pricing.js", pricing);

        AnalysisResult result = new CodeAnalyzer().analyze(tempDir, noGit);

        assertEquals(2, result.entities().size());
        assertEquals(1, result.duplicationPairs().size());
        DuplicationPair pair = result.duplicationPairs().get(0);
        assertEquals(1.0, pair.similarity());
        assertEquals(Confidence.HIGH, pair.confidence());
        assertEquals("totalFor", result.entity(pair.entityA()).orElseThrow().name());
        assertEquals("amountOf", result.entity(pair.entityB()).orElseThrow().name());
    }

    @Test
    void testBoilerplateValidatorIsFlagged() throws IOException {
        Path repo = TestFixtures.copy("fixtures", tempDir.resolve("repo"));

        AnalysisResult result = new CodeAnalyzer().analyze(repo, noGit);

        List<String> flagged = result.signals().stream()
            .map(signal -> result.entity(signal.entityId()).orElseThrow().name())
            .toList();
        assertEquals(List.of("validateOrderRequest", "validateOrderPayload"), flagged);

        ProvenanceSignal signal = result.signals().get(0);
        assertEquals(0.75, signal.probability());
        assertTrue(signal.signals().contains("uniform guard clauses"));
        assertTrue(signal.signals().contains("generic return pipeline"));
    }

    @Test
    void testShortFunctionsNeverPair() throws IOException {
        String twins = """
            function first(a) {
              const value = a.compute(a.left, a.right, a.options, "first branch label text");
              return value;
            }
            function second(b) {
              const value = b.compute(b.left, b.right, b.options, "second branch label text");
              return value;
            }
            """;
        write(tempDir, "src/twins.js", twins);
        AnalysisConfig config = noGit.withMinSignatureChars(0);

        assertTrue(new CodeAnalyzer().analyze(tempDir, config).duplicationPairs().isEmpty());
        assertEquals(1, new CodeAnalyzer().analyze(tempDir, config.withMinBodyStatements(2))
            .duplicationPairs().size());
    }

    @Test
    void testOutsideGitWorkTree() throws IOException {
        Path repo = TestFixtures.copy("fixtures", tempDir.resolve("repo"));
        GitClient notARepo = new GitClient() {
            @Override
            public boolean isWorkTree() {
                return false;
            }

            @Override
            public Optional<List<CommitRef>> fileHistory(String filePath) {
                return Optional.empty();
            }

            @Override
            public Optional<List<BlameLine>> blame(String filePath, int startLine, int endLine) {
                return Optional.empty();
            }
        };
        CodeAnalyzer analyzer = new CodeAnalyzer(new RepositoryScanner(),
            new GitEvidenceCollector(root -> notARepo, Clock.systemUTC()), new ProvenanceScorer());

        AnalysisResult result = analyzer.analyze(repo, AnalysisConfig.defaults());

        assertTrue(result.gitEvidence().isEmpty());
        assertEquals(0, result.gitEvidenceAvailableCount());
        assertEquals(2, result.signals().size());
    }

    // ==================== Property Tests ====================

    @Test
    void testDeterministic() throws IOException {
        Path repo = TestFixtures.copy("fixtures", tempDir.resolve("repo"));
        TestFixtures.copy("fixtures_js", repo.resolve("web"));

        AnalysisResult first = new CodeAnalyzer().analyze(repo, noGit);
        AnalysisResult second = new CodeAnalyzer().analyze(repo, noGit);

        assertEquals(first, second);
        assertEquals(6, first.entities().size());
    }

    @Test
    void testSameLineOverloadsShareIdAndNeverSelfPair() throws IOException {
        write(tempDir, "Codes.java", """
            public class Codes {
                int a(int x) { int y = x + 1; y = y * 2; return y; } int a(short x) { int y = x + 1; y = y * 2; return y; }
            }
            """);

        AnalysisResult result = new CodeAnalyzer().analyze(tempDir, noGit);

        assertEquals(2, result.entities().size());
        CodeEntity first = result.entities().get(0);
        CodeEntity second = result.entities().get(1);
        assertEquals("Codes.a", first.qualifiedName());
        assertEquals(first.id(), second.id());
        assertTrue(result.duplicationPairs().isEmpty());
        assertSame(first, result.entity(first.id()).orElseThrow());
    }

    @Test
    void testTestsDirectoryScope() throws IOException {
        TestFixtures.copy("fixtures_js", tempDir.resolve("tests"));
        write(tempDir, "src/app.js", "function main() { return 1; }\n");

        assertEquals(1, new CodeAnalyzer().analyze(tempDir, noGit).entities().size());
        assertEquals(4, new CodeAnalyzer().analyze(tempDir, noGit.withIncludeTests(true)).entities().size());
    }

    @Test
    void testEmptyRepository() {
        AnalysisResult result = new CodeAnalyzer().analyze(tempDir, noGit);

        assertTrue(result.entities().isEmpty());
        assertTrue(result.signals().isEmpty());
        assertTrue(result.duplicationPairs().isEmpty());
    }

    // ==================== Failure Tests ====================

    @Test
    void testMissingRootRejected() {
        assertThrows(ConfigurationException.class,
            () -> new CodeAnalyzer().analyze(tempDir.resolve("missing"), noGit));
    }

    @Test
    void testFileRootRejected() throws IOException {
        Path file = write(tempDir, "a.js", "function a() {}\n");
        assertThrows(ConfigurationException.class, () -> new CodeAnalyzer().analyze(file, noGit));
    }

    @Test
    void testInvalidConfigRejected() {
        assertThrows(ConfigurationException.class,
            () -> new CodeAnalyzer().analyze(tempDir, noGit.withHighThreshold(1.5)));
    }
}
