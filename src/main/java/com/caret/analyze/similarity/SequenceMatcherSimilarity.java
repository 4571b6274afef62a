package com.caret.analyze.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp ("gestalt pattern matching") similarity.
 * Computes similarity as 2 * M / (|a| + |b|), where M is the number of code points
 * covered by the matching blocks found by recursively taking the longest common
 * substring to the left and right of each match.
 *
 * <p>The second string is the indexed one. When it has at least
 * {@value #AUTOJUNK_MIN_LENGTH} code points, elements occurring in more than 1% of it
 * (plus one) are treated as too popular to anchor a match.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    static final int AUTOJUNK_MIN_LENGTH = 200;

    @Override
    public double compute(String candidate, String target) {
        if (candidate == null || target == null) {
            return 0.0;
        }
        int[] a = candidate.codePoints().toArray();
        int[] b = target.codePoints().toArray();
        int length = a.length + b.length;
        if (length == 0) {
            return 1.0;
        }
        return 2.0 * countMatches(a, b) / length;
    }

    @Override
    public String getName() {
        return "Ratcliff-Obershelp";
    }

    /**
     * Sums the sizes of all matching blocks between {@code a} and {@code b}.
     */
    int countMatches(int[] a, int[] b) {
        Map<Integer, List<Integer>> b2j = indexPositions(b);

        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] match = findLongestMatch(a, b, b2j, alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int k = match[2];
            if (k == 0) {
                continue;
            }
            matched += k;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    /**
     * Maps each element of {@code b} to its ascending positions, dropping popular elements
     * from long sequences.
     */
    private Map<Integer, List<Integer>> indexPositions(int[] b) {
        Map<Integer, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            b2j.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }

        int n = b.length;
        if (n >= AUTOJUNK_MIN_LENGTH) {
            int popularLimit = n / 100 + 1;
            b2j.values().removeIf(positions -> positions.size() > popularLimit);
        }
        return b2j;
    }

    /**
     * Finds the longest block a[i, i+k) == b[j, j+k) within the given ranges.
     * Among equally long blocks the one starting earliest in {@code a}, then in {@code b}, wins.
     *
     * @return {@code {i, j, k}}; {@code k == 0} when there is no match
     */
    private int[] findLongestMatch(int[] a, int[] b, Map<Integer, List<Integer>> b2j,
                                   int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        // j2len[j - blo + 1] = length of the longest match ending at a[i-1] and b[j]
        int width = bhi - blo;
        int[] j2len = new int[width + 1];
        int[] newJ2len = new int[width + 1];
        for (int i = alo; i < ahi; i++) {
            Arrays.fill(newJ2len, 0);
            List<Integer> positions = b2j.get(a[i]);
            if (positions != null) {
                for (int j : positions) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len[j - blo] + 1;
                    newJ2len[j - blo + 1] = k;
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            int[] swap = j2len;
            j2len = newJ2len;
            newJ2len = swap;
        }

        // Popular elements never anchor a match but may still extend one.
        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }
        return new int[]{besti, bestj, bestSize};
    }
}
