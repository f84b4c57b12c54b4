package io.codewaste.scanner;

import io.codewaste.CodeEntity;
import io.codewaste.ConfigurationException;
import io.codewaste.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a repository and extracts function entities from every supported file.
 *
 * <p>Directories holding VCS metadata, virtual environments, dependencies and
 * build output are pruned. The root itself is resolved to its real path;
 * symbolic-link directories below it are not followed. A file
 * that cannot be read, decoded or understood contributes nothing.</p>
 */
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    static final Set<String> PRUNED_DIRECTORIES = Set.of(
        ".git", ".hg", ".svn", ".venv", "venv", "node_modules", "__pycache__",
        ".mypy_cache", ".pytest_cache", "dist", "build", "target", ".gradle", ".idea");

    static final String TESTS_DIRECTORY = "tests";

    private final Map<SourceLanguage, EntityExtractor> extractors;

    public RepositoryScanner() {
        this(defaultExtractors());
    }

    public RepositoryScanner(Map<SourceLanguage, EntityExtractor> extractors) {
        this.extractors = new EnumMap<>(extractors);
    }

    private static Map<SourceLanguage, EntityExtractor> defaultExtractors() {
        EntityExtractor script = new ScriptEntityExtractor();
        return Map.of(
            SourceLanguage.JAVA, new JavaEntityExtractor(),
            SourceLanguage.JAVASCRIPT, script,
            SourceLanguage.TYPESCRIPT, script);
    }

    /**
     * Scans the repository.
     *
     * @param root         repository root directory
     * @param includeTests whether directories named {@code tests} are scanned
     * @return entities ordered by file path, then start line
     */
    public List<CodeEntity> scan(Path root, boolean includeTests) {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Repository root is not a directory: " + root);
        }

        Path realRoot = realPath(root);
        List<Path> files = collectFiles(realRoot, includeTests);
        List<CodeEntity> entities = new ArrayList<>();
        for (Path file : files) {
            entities.addAll(scanFile(realRoot, file));
        }

        entities.sort(Comparator.comparing(CodeEntity::filePath).thenComparingInt(CodeEntity::lineStart));
        log.debug("Scanned {} files under {}, {} entities", files.size(), root, entities.size());
        return entities;
    }

    private static Path realPath(Path root) {
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot resolve repository root " + root + ": " + e.getMessage());
        }
    }

    private List<Path> collectFiles(Path root, boolean includeTests) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    if (PRUNED_DIRECTORIES.contains(name) || (!includeTests && TESTS_DIRECTORY.equals(name))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && SourceLanguage.forPath(file.getFileName().toString()).isPresent()) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Cannot visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.debug("Walk of {} stopped early: {}", root, e.getMessage());
        }
        return files;
    }

    private List<CodeEntity> scanFile(Path root, Path file) {
        String relativePath = relativePath(root, file);
        Optional<SourceLanguage> language = SourceLanguage.forPath(relativePath);
        EntityExtractor extractor = language.map(extractors::get).orElse(null);
        if (extractor == null) {
            return List.of();
        }

        Optional<String> source = readStrictUtf8(file);
        if (source.isEmpty()) {
            return List.of();
        }

        try {
            return extractor.extract(relativePath, source.get());
        } catch (RuntimeException e) {
            log.debug("Skipping {}: {}", relativePath, e.toString());
            return List.of();
        }
    }

    static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    private static Optional<String> readStrictUtf8(Path file) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
            return Optional.of(text);
        } catch (CharacterCodingException e) {
            log.debug("Skipping {}: not valid UTF-8", file);
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Skipping {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
