package io.codewaste;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A function or method definition located in a scanned repository.
 *
 * <p>Entities are created fresh on every scan and never mutated. The id is a
 * pure function of file path, qualified name and start line, so re-scanning an
 * unchanged file reproduces the same ids. Overloads declared on the same line
 * share a qualified name and therefore an id: they are never paired with each
 * other, and id lookups resolve to the first in scan order.</p>
 */
public record CodeEntity(
    /** Stable identifier (12 hex chars) */
    String id,

    /** Repository-relative path, always '/'-separated */
    String filePath,

    /** Simple function name */
    String name,

    /** Module path + enclosing types + simple name, dot-joined */
    String qualifiedName,

    /** Starting line number (1-indexed) */
    int lineStart,

    /** Ending line number (1-indexed, inclusive) */
    int lineEnd,

    /** Exact source lines [lineStart, lineEnd] */
    String source
) {
    private static final int ID_LENGTH = 12;

    public CodeEntity {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(filePath, "filePath cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        if (lineStart < 1) throw new IllegalArgumentException("lineStart must be >= 1");
        if (lineEnd < lineStart) throw new IllegalArgumentException("lineEnd must be >= lineStart");
    }

    /**
     * Creates an entity, deriving its id from location and qualified name.
     */
    public static CodeEntity of(String filePath, String name, String qualifiedName,
                                int lineStart, int lineEnd, String source) {
        String id = generateId(filePath, qualifiedName, lineStart);
        return new CodeEntity(id, filePath, name, qualifiedName, lineStart, lineEnd, source);
    }

    static String generateId(String filePath, String qualifiedName, int lineStart) {
        String key = filePath + ":" + qualifiedName + ":" + lineStart;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] hash = md.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Language of the file this entity was extracted from.
     */
    public SourceLanguage language() {
        return SourceLanguage.forPath(filePath).orElseThrow(
            () -> new IllegalStateException("Unsupported source file: " + filePath));
    }

    /**
     * Short "path:line" reference used in reports.
     */
    public String location() {
        return filePath + ":" + lineStart;
    }
}
