package io.codewaste;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages the scanner understands.
 *
 * <p>Java is parsed into a full syntax tree. JavaScript and TypeScript have no
 * parser here and are scanned lexically.</p>
 */
public enum SourceLanguage {
    JAVA(false, ".java"),
    JAVASCRIPT(true, ".js", ".jsx", ".mjs", ".cjs"),
    TYPESCRIPT(true, ".ts", ".tsx");

    private final boolean lexical;
    private final List<String> extensions;

    SourceLanguage(boolean lexical, String... extensions) {
        this.lexical = lexical;
        this.extensions = List.of(extensions);
    }

    public boolean isLexical() {
        return lexical;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Resolves the language from a file name or path, if supported.
     */
    public static Optional<SourceLanguage> forPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.extensions.stream().anyMatch(lower::endsWith))
            .findFirst();
    }
}
