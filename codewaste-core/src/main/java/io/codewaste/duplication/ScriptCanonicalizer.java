package io.codewaste.duplication;

import io.codewaste.CodeEntity;
import io.codewaste.scanner.ScriptFunction;
import io.codewaste.scanner.ScriptFunctionLocator;
import io.codewaste.scanner.ScriptTokenizer;
import io.codewaste.scanner.ScriptTokenizer.Token;

import java.util.List;
import java.util.Optional;

/**
 * Canonicalizes JavaScript/TypeScript functions lexically.
 *
 * <p>Comments are dropped, string and template literals become {@code STR},
 * numbers {@code NUM} and non-keyword identifiers {@code ID}.</p>
 */
public class ScriptCanonicalizer implements Canonicalizer {

    @Override
    public Optional<CanonicalSignature> canonicalize(CodeEntity entity) {
        String source = entity.source();
        Optional<ScriptFunction> function = ScriptFunctionLocator.first(source);
        if (function.isEmpty()) {
            return Optional.empty();
        }

        List<String> tokens = ScriptTokenizer.tokenize(function.get().declaration(source)).stream()
            .map(ScriptCanonicalizer::canonical)
            .toList();
        int statements = ScriptTokenizer.countStatements(
            ScriptTokenizer.tokenize(function.get().body(source)));
        return Optional.of(new CanonicalSignature(entity.id(), tokens, statements));
    }

    private static String canonical(Token token) {
        return switch (token.kind()) {
            case IDENTIFIER -> "ID";
            case STRING -> "STR";
            case NUMBER -> "NUM";
            case KEYWORD, PUNCTUATION -> token.text();
        };
    }
}
