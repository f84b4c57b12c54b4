package io.codewaste.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Source text with a line index, for offset-to-line lookups and line slicing.
 *
 * <p>Line terminators are {@code \n}, {@code \r\n} and a lone {@code \r},
 * matching {@link String#lines()}.</p>
 */
public final class SourceText {

    private final String text;
    private final int[] lineStarts;
    private List<String> lines;

    public SourceText(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String text() {
        return text;
    }

    /**
     * Returns the 1-based line containing the given character offset.
     */
    public int lineAt(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * Returns lines [startLine, endLine] (1-based, inclusive) joined by {@code \n}.
     */
    public String slice(int startLine, int endLine) {
        if (lines == null) {
            lines = text.lines().toList();
        }
        int from = Math.max(startLine - 1, 0);
        int to = Math.min(endLine, lines.size());
        if (from >= to) {
            return "";
        }
        return String.join("\n", lines.subList(from, to));
    }
}
