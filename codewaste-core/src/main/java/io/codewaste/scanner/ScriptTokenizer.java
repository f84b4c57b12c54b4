package io.codewaste.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits JavaScript/TypeScript text into coarse tokens.
 *
 * <p>Comments are dropped. Every other character belongs to exactly one
 * token; operators are emitted one character at a time.</p>
 */
public final class ScriptTokenizer {

    public enum Kind {
        IDENTIFIER,
        KEYWORD,
        STRING,
        NUMBER,
        PUNCTUATION
    }

    /**
     * @param kind token class
     * @param text identifier or keyword text, literal contents without
     *             delimiters for strings, the character itself for punctuation
     */
    public record Token(Kind kind, String text) {

        public boolean is(String value) {
            return kind != Kind.STRING && text.equals(value);
        }
    }

    public static final Set<String> KEYWORDS = Set.of(
        "async", "await", "break", "case", "catch", "class", "const", "continue",
        "debugger", "default", "delete", "do", "else", "export", "extends", "false",
        "finally", "for", "function", "if", "import", "in", "instanceof", "let",
        "new", "null", "of", "return", "static", "super", "switch", "this", "throw",
        "true", "try", "typeof", "undefined", "var", "void", "while", "with", "yield",
        // TypeScript
        "as", "enum", "implements", "interface", "private", "protected", "public", "readonly");

    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "do", "switch", "try");

    private ScriptTokenizer() {
    }

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (ch == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                int newline = text.indexOf('\n', i);
                i = newline < 0 ? n : newline;
            } else if (ch == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
            } else if (ch == '\'' || ch == '"') {
                int end = BraceMatcher.skipQuoted(text, i);
                int contentEnd = end > i + 1 && text.charAt(end - 1) == ch ? end - 1 : end;
                tokens.add(new Token(Kind.STRING, text.substring(i + 1, Math.max(i + 1, contentEnd))));
                i = end;
            } else if (ch == '`') {
                int end = BraceMatcher.skipTemplate(text, i);
                int contentEnd = end < 0 ? n : end - 1;
                tokens.add(new Token(Kind.STRING, text.substring(i + 1, Math.max(i + 1, contentEnd))));
                i = end < 0 ? n : end;
            } else if (Character.isDigit(ch) || (ch == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                int end = i + 1;
                while (end < n && (Character.isLetterOrDigit(text.charAt(end))
                        || text.charAt(end) == '.' || text.charAt(end) == '_')) {
                    end++;
                }
                tokens.add(new Token(Kind.NUMBER, text.substring(i, end)));
                i = end;
            } else if (Character.isJavaIdentifierStart(ch)) {
                int end = i + 1;
                while (end < n && Character.isJavaIdentifierPart(text.charAt(end))) {
                    end++;
                }
                String word = text.substring(i, end);
                tokens.add(new Token(KEYWORDS.contains(word) ? Kind.KEYWORD : Kind.IDENTIFIER, word));
                i = end;
            } else {
                tokens.add(new Token(Kind.PUNCTUATION, String.valueOf(ch)));
                i++;
            }
        }
        return tokens;
    }

    /**
     * Estimates the number of top-level statements in a function body
     * (the text between its braces): semicolons at depth zero outside
     * parentheses, plus control keywords at depth zero. An {@code if}
     * directly after {@code else} is part of the same statement.
     */
    public static int countStatements(List<Token> bodyTokens) {
        int count = 0;
        int braces = 0;
        int parens = 0;
        Token previous = null;
        for (Token token : bodyTokens) {
            if (token.kind() == Kind.PUNCTUATION) {
                switch (token.text()) {
                    case "{" -> braces++;
                    case "}" -> braces--;
                    case "(" -> parens++;
                    case ")" -> parens--;
                    case ";" -> {
                        if (braces == 0 && parens == 0) count++;
                    }
                    default -> {
                    }
                }
            } else if (token.kind() == Kind.KEYWORD && braces == 0 && parens == 0
                    && CONTROL_KEYWORDS.contains(token.text())
                    && !(token.text().equals("if") && previous != null && previous.is("else"))) {
                count++;
            }
            previous = token;
        }
        return count;
    }
}
