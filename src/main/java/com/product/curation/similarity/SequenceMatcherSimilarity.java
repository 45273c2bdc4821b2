package com.product.curation.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gestalt pattern-matching similarity (Ratcliff/Obershelp).
 *
 * <p>Finds the longest common block, recurses on the unmatched text to its left and right,
 * and scores {@code 2 * M / (|a| + |b|)} where {@code M} is the total size of all matched
 * blocks. Scores are not symmetric in general; the second operand is the indexed one.</p>
 *
 * <p>For operands of 200 characters or more, characters occurring in more than 1% of the
 * second operand are not used to seed matches, which keeps long inputs near-linear.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    private static final int POPULAR_THRESHOLD_LENGTH = 200;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int matches = matchingCharacters(s1, s2);
        return 2.0 * matches / (s1.length() + s2.length());
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    /**
     * Total size of the matching blocks between {@code a} and {@code b}.
     */
    int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> b2j = indexOf(b);
        int total = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];
            int[] match = longestMatch(a, b, b2j, alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int k = match[2];
            if (k > 0) {
                total += k;
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + k < ahi && j + k < bhi) {
                    queue.push(new int[]{i + k, ahi, j + k, bhi});
                }
            }
        }
        return total;
    }

    private Map<Character, List<Integer>> indexOf(String b) {
        Map<Character, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            b2j.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }
        int n = b.length();
        if (n >= POPULAR_THRESHOLD_LENGTH) {
            int popular = n / 100 + 1;
            b2j.values().removeIf(indices -> indices.size() > popular);
        }
        return b2j;
    }

    /**
     * Longest block {@code a[i..i+k) == b[j..j+k)} inside the given ranges, earliest in
     * {@code a} on ties and then earliest in {@code b}. Returns {i, j, k}.
     */
    private int[] longestMatch(String a, String b, Map<Character, List<Integer>> b2j,
                               int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newJ2len = new HashMap<>();
            List<Integer> indices = b2j.get(a.charAt(i));
            if (indices != null) {
                for (int j : indices) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    newJ2len.put(j, k);
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            j2len = newJ2len;
        }
        // Popular characters never seed a match but may still extend one.
        while (besti > alo && bestj > blo && a.charAt(besti - 1) == b.charAt(bestj - 1)) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a.charAt(besti + bestSize) == b.charAt(bestj + bestSize)) {
            bestSize++;
        }
        return new int[]{besti, bestj, bestSize};
    }
}
