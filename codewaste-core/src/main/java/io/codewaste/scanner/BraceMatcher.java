package io.codewaste.scanner;

/**
 * Literal- and comment-aware character scanning for JavaScript/TypeScript.
 *
 * <p>This is not a parser. It knows just enough of the lexical grammar to find
 * the brace (or parenthesis) that closes a given opening one: the contents of
 * {@code '...'}, {@code "..."} and {@code `...`} literals (including nested
 * {@code ${...}} expressions) and of line and block comments never change the
 * nesting depth. Regular-expression literals are not recognized.</p>
 */
public final class BraceMatcher {

    private BraceMatcher() {
    }

    /**
     * Finds the brace that closes the one at {@code openIndex}.
     *
     * @return index of the matching {@code '}'}, or -1 if there is none
     */
    public static int findMatchingBrace(String text, int openIndex) {
        return findMatching(text, openIndex, '{', '}');
    }

    /**
     * Finds the parenthesis that closes the one at {@code openIndex}.
     *
     * @return index of the matching {@code ')'}, or -1 if there is none
     */
    public static int findMatchingParen(String text, int openIndex) {
        return findMatching(text, openIndex, '(', ')');
    }

    static int findMatching(String text, int openIndex, char open, char close) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != open) {
            return -1;
        }
        int depth = 0;
        int i = openIndex;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (ch == '\'' || ch == '"') {
                i = skipQuoted(text, i);
                continue;
            }
            if (ch == '`') {
                i = skipTemplate(text, i);
                if (i < 0) return -1;
                continue;
            }
            if (ch == '/' && i + 1 < n) {
                char next = text.charAt(i + 1);
                if (next == '/') {
                    i = skipLineComment(text, i);
                    continue;
                }
                if (next == '*') {
                    i = skipBlockComment(text, i);
                    if (i < 0) return -1;
                    continue;
                }
            }
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Returns a copy of {@code text} with comments blanked and string/template
     * literal contents replaced by spaces. Delimiters, newlines and offsets
     * are preserved, so matches on the masked text map 1:1 onto the original.
     */
    public static String mask(String text) {
        char[] out = text.toCharArray();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);
            int end;
            if (ch == '\'' || ch == '"') {
                end = skipQuoted(text, i);
                blank(out, i + 1, Math.max(i + 1, end - 1));
                if (end > 0 && text.charAt(end - 1) != ch) {
                    // unterminated on this line: keep the newline
                    blank(out, i + 1, end);
                }
            } else if (ch == '`') {
                end = skipTemplate(text, i);
                if (end < 0) end = n;
                blank(out, i + 1, Math.max(i + 1, end - 1));
            } else if (ch == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                end = skipLineComment(text, i);
                blank(out, i, end);
            } else if (ch == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                end = skipBlockComment(text, i);
                if (end < 0) end = n;
                blank(out, i, end);
            } else {
                end = i + 1;
            }
            i = end;
        }
        return new String(out);
    }

    private static void blank(char[] out, int from, int to) {
        for (int k = from; k < to && k < out.length; k++) {
            if (out[k] != '\n' && out[k] != '\r') {
                out[k] = ' ';
            }
        }
    }

    /** Returns the index just past the closing quote, or the line end if unterminated. */
    static int skipQuoted(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                return i + 1;
            }
            if (ch == '\n') {
                return i;
            }
            i++;
        }
        return n;
    }

    /** Returns the index just past the closing backtick, or -1 if unterminated. */
    static int skipTemplate(String text, int start) {
        int i = start + 1;
        int n = text.length();
        while (i < n) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == '`') {
                return i + 1;
            }
            if (ch == '$' && i + 1 < n && text.charAt(i + 1) == '{') {
                int close = findMatchingBrace(text, i + 1);
                if (close < 0) {
                    return -1;
                }
                i = close + 1;
                continue;
            }
            i++;
        }
        return -1;
    }

    private static int skipLineComment(String text, int start) {
        int newline = text.indexOf('\n', start);
        return newline < 0 ? text.length() : newline;
    }

    private static int skipBlockComment(String text, int start) {
        int end = text.indexOf("*/", start + 2);
        return end < 0 ? -1 : end + 2;
    }
}
