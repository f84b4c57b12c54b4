package io.codewaste.scanner;

/**
 * A function located lexically in JavaScript/TypeScript text.
 *
 * @param name       declared or assigned name
 * @param start      offset of the first character of the declaration
 * @param openBrace  offset of the body's opening brace
 * @param closeBrace offset of the body's closing brace
 */
public record ScriptFunction(String name, int start, int openBrace, int closeBrace) {

    /** Text between the braces, exclusive. */
    public String body(String text) {
        return text.substring(openBrace + 1, closeBrace);
    }

    /** Declaration text from its start through the closing brace. */
    public String declaration(String text) {
        return text.substring(start, closeBrace + 1);
    }
}
