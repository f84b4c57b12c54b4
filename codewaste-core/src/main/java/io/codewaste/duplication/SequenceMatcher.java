package io.codewaste.duplication;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity over token sequences.
 *
 * <p>The ratio is {@code 2*M/T}, where {@code T} is the combined length and
 * {@code M} the number of tokens in matching blocks: the longest common
 * block is found, then the search recurses on the unmatched pieces to its
 * left and right. No token is treated as junk.</p>
 *
 * <p>The pair is put in a fixed order (shorter first, then lexicographic)
 * before matching, so {@code ratio(a, b) == ratio(b, a)} exactly.</p>
 */
public final class SequenceMatcher {

    private SequenceMatcher() {
    }

    public static double ratio(List<String> a, List<String> b) {
        int total = a.size() + b.size();
        if (total == 0) {
            return 1.0;
        }
        if (compare(a, b) > 0) {
            List<String> swap = a;
            a = b;
            b = swap;
        }

        Map<String, Integer> ids = new HashMap<>();
        int[] left = encode(a, ids);
        int[] right = encode(b, ids);
        return 2.0 * matchingTokens(left, right, ids.size()) / total;
    }

    static int compare(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return Integer.compare(a.size(), b.size());
        }
        for (int i = 0; i < a.size(); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int[] encode(List<String> tokens, Map<String, Integer> ids) {
        int[] encoded = new int[tokens.size()];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = ids.computeIfAbsent(tokens.get(i), k -> ids.size());
        }
        return encoded;
    }

    private static int matchingTokens(int[] a, int[] b, int alphabet) {
        // positions of each token in b, ascending
        int[][] positions = indexPositions(b, alphabet);
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];

        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[] {0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];
            int[] match = longestMatch(a, aLow, aHigh, bLow, bHigh, positions, previous, current);
            int size = match[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (aLow < match[0] && bLow < match[1]) {
                queue.push(new int[] {aLow, match[0], bLow, match[1]});
            }
            if (match[0] + size < aHigh && match[1] + size < bHigh) {
                queue.push(new int[] {match[0] + size, aHigh, match[1] + size, bHigh});
            }
        }
        return matched;
    }

    /**
     * Longest block a[i..i+k) == b[j..j+k) within the ranges; the earliest
     * such block in {@code a} wins ties.
     *
     * <p>{@code previous[j + 1]} holds the length of the match ending at
     * a[i-1], b[j]. Both work arrays are left zeroed on return.</p>
     */
    private static int[] longestMatch(int[] a, int aLow, int aHigh, int bLow, int bHigh,
                                      int[][] positions, int[] previous, int[] current) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        List<Integer> touchedPrevious = new ArrayList<>();
        List<Integer> touchedCurrent = new ArrayList<>();

        for (int i = aLow; i < aHigh; i++) {
            for (int j : positions[a[i]]) {
                if (j < bLow) {
                    continue;
                }
                if (j >= bHigh) {
                    break;
                }
                int k = previous[j] + 1;
                current[j + 1] = k;
                touchedCurrent.add(j + 1);
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            for (int index : touchedPrevious) {
                previous[index] = 0;
            }
            touchedPrevious.clear();

            int[] swapArray = previous;
            previous = current;
            current = swapArray;
            List<Integer> swapList = touchedPrevious;
            touchedPrevious = touchedCurrent;
            touchedCurrent = swapList;
        }
        for (int index : touchedPrevious) {
            previous[index] = 0;
        }
        return new int[] {bestI, bestJ, bestSize};
    }

    private static int[][] indexPositions(int[] b, int alphabet) {
        int[] counts = new int[alphabet];
        for (int token : b) {
            counts[token]++;
        }
        int[][] positions = new int[alphabet][];
        for (int token = 0; token < alphabet; token++) {
            positions[token] = new int[counts[token]];
        }
        Arrays.fill(counts, 0);
        for (int j = 0; j < b.length; j++) {
            positions[b[j]][counts[b[j]]++] = j;
        }
        return positions;
    }
}
