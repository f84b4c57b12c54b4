package io.codewaste.provenance;

import io.codewaste.CodeEntity;
import io.codewaste.scanner.BraceMatcher;
import io.codewaste.scanner.ScriptFunction;
import io.codewaste.scanner.ScriptFunctionLocator;
import io.codewaste.scanner.ScriptTokenizer;
import io.codewaste.scanner.ScriptTokenizer.Kind;
import io.codewaste.scanner.ScriptTokenizer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximates provenance features on JavaScript/TypeScript text.
 */
public class ScriptFeatureExtractor implements FeatureExtractor {

    private static final Pattern IF_OPENING = Pattern.compile("\\bif\\s*\\(");
    private static final Pattern RETURN_OR_THROW = Pattern.compile("\\b(?:return|throw)\\b");

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("const", "let", "var");
    private static final Set<String> LOOP_KEYWORDS = Set.of("for", "while");

    @Override
    public Optional<FunctionFeatures> extract(CodeEntity entity) {
        String source = entity.source();
        Optional<ScriptFunction> function = ScriptFunctionLocator.first(source);
        if (function.isEmpty()) {
            return Optional.empty();
        }
        String body = function.get().body(source);
        List<Token> tokens = ScriptTokenizer.tokenize(body);

        return Optional.of(new FunctionFeatures(
            ScriptTokenizer.countStatements(tokens),
            guardClauses(BraceMatcher.mask(body)),
            assignedNames(tokens),
            (int) tokens.stream().filter(token -> token.kind() == Kind.KEYWORD && token.is("if")).count(),
            errorLiterals(tokens),
            returnedName(tokens),
            tokens.stream().anyMatch(token -> token.kind() == Kind.KEYWORD && LOOP_KEYWORDS.contains(token.text()))
        ));
    }

    /**
     * Counts {@code if (...) { ... return|throw ... }} with any condition and a
     * block holding no nested braces.
     */
    static int guardClauses(String maskedBody) {
        Matcher matcher = IF_OPENING.matcher(maskedBody);
        int count = 0;
        int from = 0;
        while (matcher.find(from)) {
            int closeParen = BraceMatcher.findMatchingParen(maskedBody, matcher.end() - 1);
            if (closeParen < 0) {
                break;
            }
            from = closeParen + 1;
            int openBrace = skipWhitespace(maskedBody, from);
            if (openBrace >= maskedBody.length() || maskedBody.charAt(openBrace) != '{') {
                continue;
            }
            int closeBrace = BraceMatcher.findMatchingBrace(maskedBody, openBrace);
            if (closeBrace < 0) {
                continue;
            }
            String block = maskedBody.substring(openBrace + 1, closeBrace);
            if (block.indexOf('{') < 0 && RETURN_OR_THROW.matcher(block).find()) {
                count++;
            }
        }
        return count;
    }

    private static int skipWhitespace(String text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static List<String> assignedNames(List<Token> tokens) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token next = tokens.get(i + 1);
            if (token.kind() == Kind.KEYWORD && DECLARATION_KEYWORDS.contains(token.text())
                    && next.kind() == Kind.IDENTIFIER) {
                names.add(next.text().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static List<String> errorLiterals(List<Token> tokens) {
        return tokens.stream()
            .filter(token -> token.kind() == Kind.STRING)
            .map(Token::text)
            .filter(FunctionFeatures::isErrorLike)
            .map(literal -> literal.toLowerCase(Locale.ROOT))
            .toList();
    }

    /** {@code return name;} as the body's final statement. */
    private static Optional<String> returnedName(List<Token> tokens) {
        int end = tokens.size();
        while (end > 0 && tokens.get(end - 1).is(";")) {
            end--;
        }
        if (end < 2) {
            return Optional.empty();
        }
        Token keyword = tokens.get(end - 2);
        Token name = tokens.get(end - 1);
        if (keyword.kind() == Kind.KEYWORD && keyword.is("return") && name.kind() == Kind.IDENTIFIER) {
            return Optional.of(name.text());
        }
        return Optional.empty();
    }
}
