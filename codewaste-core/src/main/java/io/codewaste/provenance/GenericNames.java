package io.codewaste.provenance;

import java.util.Locale;
import java.util.Set;

/**
 * Placeholder-style variable names typical of generated code.
 */
public final class GenericNames {

    public static final Set<String> NAMES = Set.of(
        "data", "input", "output", "result", "value", "item",
        "obj", "response", "request", "temp", "payload");

    private GenericNames() {
    }

    public static boolean isGeneric(String name) {
        return name != null && NAMES.contains(name.toLowerCase(Locale.ROOT));
    }
}
