package io.codewaste.scanner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds function definitions in JavaScript/TypeScript without parsing.
 *
 * <p>Patterns run over {@link BraceMatcher#mask masked} text so that
 * look-alikes inside comments and string literals are ignored. Class methods
 * and object-literal methods are not recognized.</p>
 */
public final class ScriptFunctionLocator {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";
    private static final String DECLARE = "(?:export\\s+)?(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::[^=;]+)?=\\s*";

    private record FunctionPattern(Pattern pattern, boolean bodyAfterParameters) {
    }

    // Order matters: an earlier pattern claims a start offset or brace first.
    private static final List<FunctionPattern> PATTERNS = List.of(
        new FunctionPattern(Pattern.compile(
            "\\b(?:export\\s+(?:default\\s+)?)?(?:async\\s+)?function\\b\\s*\\*?\\s*(" + IDENT + ")\\s*(?:<[^>()]*>\\s*)?\\("),
            true),
        new FunctionPattern(Pattern.compile(
            "\\b" + DECLARE + "(?:async\\s+)?function\\b\\s*\\*?\\s*(?:" + IDENT + ")?\\s*(?:<[^>()]*>\\s*)?\\("),
            true),
        new FunctionPattern(Pattern.compile(
            "\\b" + DECLARE + "(?:async\\s*)?(?:<[^>()]*>\\s*)?\\([^()]*\\)\\s*(?::\\s*[^={;]+?)?\\s*=>\\s*\\{"),
            false),
        new FunctionPattern(Pattern.compile(
            "\\b" + DECLARE + "(?:async\\s+)?" + IDENT + "\\s*=>\\s*\\{"),
            false)
    );

    private ScriptFunctionLocator() {
    }

    /**
     * Locates every recognizable function, sorted by start offset.
     */
    public static List<ScriptFunction> locate(String text) {
        String masked = BraceMatcher.mask(text);
        Set<Integer> claimedStarts = new HashSet<>();
        Set<Integer> claimedBraces = new HashSet<>();
        List<ScriptFunction> found = new ArrayList<>();

        for (FunctionPattern candidate : PATTERNS) {
            Matcher matcher = candidate.pattern().matcher(masked);
            while (matcher.find()) {
                int start = matcher.start();
                if (claimedStarts.contains(start)) {
                    continue;
                }
                int openBrace = candidate.bodyAfterParameters()
                    ? braceAfterParameters(masked, matcher.end() - 1)
                    : matcher.end() - 1;
                if (openBrace < 0 || claimedBraces.contains(openBrace)) {
                    continue;
                }
                int closeBrace = BraceMatcher.findMatchingBrace(text, openBrace);
                if (closeBrace < 0) {
                    continue;
                }
                claimedStarts.add(start);
                claimedBraces.add(openBrace);
                found.add(new ScriptFunction(matcher.group(1), start, openBrace, closeBrace));
            }
        }

        found.sort(Comparator.comparingInt(ScriptFunction::start));
        return found;
    }

    /**
     * First located function in the text, if any.
     */
    public static Optional<ScriptFunction> first(String text) {
        List<ScriptFunction> functions = locate(text);
        return functions.isEmpty() ? Optional.empty() : Optional.of(functions.get(0));
    }

    /**
     * Skips the balanced parameter list starting at {@code openParen} and returns
     * the body's opening brace, or -1 for an overload signature or declaration.
     */
    private static int braceAfterParameters(String masked, int openParen) {
        int closeParen = BraceMatcher.findMatchingParen(masked, openParen);
        if (closeParen < 0) {
            return -1;
        }
        for (int i = closeParen + 1; i < masked.length(); i++) {
            char ch = masked.charAt(i);
            if (ch == '{') {
                return i;
            }
            if (ch == ';') {
                return -1;
            }
        }
        return -1;
    }
}
