package io.codewaste.scanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives dotted module paths from repository-relative file paths.
 */
public final class ModulePaths {

    private static final String INDEX = "index";

    private ModulePaths() {
    }

    /**
     * {@code src/orders/service.js} becomes {@code src.orders.service};
     * a trailing {@code index} segment is dropped, so a root {@code index.js}
     * has an empty module path.
     */
    public static String modulePath(String relativePath) {
        return String.join(".", segments(relativePath));
    }

    static List<String> segments(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        int dot = normalized.lastIndexOf('.');
        if (dot > slash) {
            normalized = normalized.substring(0, dot);
        }
        List<String> parts = new ArrayList<>(Arrays.stream(normalized.split("/"))
            .filter(part -> !part.isEmpty())
            .toList());
        if (!parts.isEmpty() && parts.get(parts.size() - 1).equals(INDEX)) {
            parts.remove(parts.size() - 1);
        }
        return parts;
    }

    /**
     * Joins a module path, enclosing names and a simple name into a qualified name.
     */
    public static String qualify(String modulePath, List<String> enclosing, String name) {
        List<String> parts = new ArrayList<>();
        if (!modulePath.isEmpty()) {
            parts.add(modulePath);
        }
        parts.addAll(enclosing);
        parts.add(name);
        return String.join(".", parts);
    }
}
