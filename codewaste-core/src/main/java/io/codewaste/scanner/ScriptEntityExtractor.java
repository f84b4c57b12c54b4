package io.codewaste.scanner;

import io.codewaste.CodeEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts function entities from JavaScript/TypeScript text.
 *
 * <p>Qualified names are the module path plus the function name; the lexical
 * scan does not track enclosing scopes.</p>
 */
public class ScriptEntityExtractor implements EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(ScriptEntityExtractor.class);

    @Override
    public List<CodeEntity> extract(String relativePath, String source) {
        SourceText text = new SourceText(source);
        String modulePath = ModulePaths.modulePath(relativePath);

        List<CodeEntity> entities = new ArrayList<>();
        for (ScriptFunction function : ScriptFunctionLocator.locate(source)) {
            int lineStart = text.lineAt(function.start());
            int lineEnd = text.lineAt(function.closeBrace());
            String qualifiedName = ModulePaths.qualify(modulePath, List.of(), function.name());
            entities.add(CodeEntity.of(relativePath, function.name(), qualifiedName,
                lineStart, lineEnd, text.slice(lineStart, lineEnd)));
        }

        log.debug("Extracted {} entities from {}", entities.size(), relativePath);
        return entities;
    }
}
