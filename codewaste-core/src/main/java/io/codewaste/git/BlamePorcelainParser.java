package io.codewaste.git;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the output of {@code git blame --line-porcelain}.
 *
 * <p>Every source line is preceded by a header {@code <hash> <orig> <final> [<count>]}
 * and a full block of {@code key value} lines; the source line itself starts
 * with a tab.</p>
 */
public final class BlamePorcelainParser {

    private static final Pattern HEADER = Pattern.compile("^[0-9a-f]{40}\\s+\\d+\\s+\\d+(?:\\s+\\d+)?$");
    private static final String AUTHOR = "author ";
    private static final String AUTHOR_TIME = "author-time ";

    private BlamePorcelainParser() {
    }

    public static List<BlameLine> parse(String output) {
        List<BlameLine> lines = new ArrayList<>();
        String commit = null;
        String author = null;
        Long authorTime = null;

        for (String line : output.split("\n")) {
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            if (HEADER.matcher(line).matches()) {
                commit = line.substring(0, line.indexOf(' '));
                author = null;
                authorTime = null;
            } else if (line.startsWith(AUTHOR_TIME)) {
                authorTime = parseTime(line.substring(AUTHOR_TIME.length()).trim());
            } else if (line.startsWith(AUTHOR)) {
                author = line.substring(AUTHOR.length()).trim();
            } else if (line.startsWith("\t") && commit != null) {
                lines.add(new BlameLine(commit, author, authorTime));
            }
        }
        return lines;
    }

    private static Long parseTime(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
