package io.codewaste.scanner;

import io.codewaste.CodeEntity;
import io.codewaste.ConfigurationException;
import io.codewaste.SourceLanguage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.codewaste.TestFixtures.write;
import static org.junit.jupiter.api.Assertions.*;

class RepositoryScannerTest {

    @TempDir
    Path tempDir;

    private static final String JS_FUNCTION = "function f() { return 1; }\n";

    private List<String> scannedFiles(boolean includeTests) {
        return new RepositoryScanner().scan(tempDir, includeTests).stream()
            .map(CodeEntity::filePath)
            .toList();
    }

    // ==================== Walk Tests ====================

    @Test
    void testFindsJavaAndScriptFiles() throws IOException {
        write(tempDir, "src/app.js", JS_FUNCTION);
        write(tempDir, "src/view.tsx", "export const View = () => { return null; };\n");
        write(tempDir, "src/Main.java", "class Main { void run() { } }\n");
        write(tempDir, "README.md", "function notCode() { }\n");

        assertEquals(List.of("src/Main.java", "src/app.js", "src/view.tsx"), scannedFiles(false));
    }

    @Test
    void testPrunedDirectoriesSkipped() throws IOException {
        write(tempDir, "node_modules/lib/index.js", JS_FUNCTION);
        write(tempDir, "target/classes/Gen.java", "class Gen { void g() { } }\n");
        write(tempDir, ".git/hooks/hook.js", JS_FUNCTION);
        write(tempDir, "lib/keep.js", JS_FUNCTION);

        assertEquals(List.of("lib/keep.js"), scannedFiles(false));
    }

    @Test
    void testTestsDirectoryScope() throws IOException {
        write(tempDir, "tests/helper.js", JS_FUNCTION);
        write(tempDir, "src/app.js", JS_FUNCTION);

        assertEquals(List.of("src/app.js"), scannedFiles(false));
        assertEquals(List.of("src/app.js", "tests/helper.js"), scannedFiles(true));
    }

    @Test
    void testOrderedByPathThenLine() throws IOException {
        write(tempDir, "b.js", "function b1() { }\nfunction b2() { }\n");
        write(tempDir, "a.js", "function a1() { }\n");

        List<CodeEntity> entities = new RepositoryScanner().scan(tempDir, false);

        assertEquals(List.of("a1", "b1", "b2"), entities.stream().map(CodeEntity::name).toList());
        assertEquals(2, entities.get(2).lineStart());
    }

    @Test
    void testSymlinkedRootIsScanned() throws IOException {
        Path real = Files.createDirectories(tempDir.resolve("real"));
        write(real, "src/app.js", JS_FUNCTION);
        Path link = Files.createSymbolicLink(tempDir.resolve("link"), real);

        List<CodeEntity> viaLink = new RepositoryScanner().scan(link, false);

        assertEquals(1, viaLink.size());
        assertEquals("src/app.js", viaLink.get(0).filePath());
        assertEquals(new RepositoryScanner().scan(real, false), viaLink);
    }

    @Test
    void testSymlinkedChildDirectoryNotFollowed() throws IOException {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        write(outside, "lib.js", JS_FUNCTION);
        Path repo = Files.createDirectories(tempDir.resolve("repo"));
        write(repo, "src/app.js", JS_FUNCTION);
        Files.createSymbolicLink(repo.resolve("vendor"), outside);

        List<String> files = new RepositoryScanner().scan(repo, false).stream()
            .map(CodeEntity::filePath)
            .toList();

        assertEquals(List.of("src/app.js"), files);
    }

    // ==================== Failure Tests ====================

    @Test
    void testInvalidUtf8Skipped() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.write(tempDir.resolve("src/bad.js"),
            new byte[]{'f', 'u', 'n', 'c', (byte) 0xC3, (byte) 0x28, ' ', '{', '}'});
        write(tempDir, "src/good.js", JS_FUNCTION);

        assertEquals(List.of("src/good.js"), scannedFiles(false));
    }

    @Test
    void testFailingExtractorSkipsFile() throws IOException {
        write(tempDir, "a.js", JS_FUNCTION);
        EntityExtractor failing = (path, source) -> {
            throw new IllegalStateException("boom");
        };
        RepositoryScanner scanner = new RepositoryScanner(Map.of(SourceLanguage.JAVASCRIPT, failing));

        assertTrue(scanner.scan(tempDir, false).isEmpty());
    }

    @Test
    void testMissingRootRejected() {
        assertThrows(ConfigurationException.class,
            () -> new RepositoryScanner().scan(tempDir.resolve("missing"), false));
    }

    @Test
    void testRelativePathUsesForwardSlashes() {
        Path file = tempDir.resolve("a").resolve("b").resolve("c.js");
        assertEquals("a/b/c.js", RepositoryScanner.relativePath(tempDir, file));
    }
}
