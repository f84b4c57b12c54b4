package io.codewaste.scanner;

import io.codewaste.CodeEntity;

import java.util.List;

/**
 * Extracts function entities from the text of one source file.
 */
public interface EntityExtractor {

    /**
     * @param relativePath repository-relative, '/'-separated path of the file
     * @param source       decoded file contents
     * @return entities in source order; empty if the file cannot be understood
     */
    List<CodeEntity> extract(String relativePath, String source);
}
