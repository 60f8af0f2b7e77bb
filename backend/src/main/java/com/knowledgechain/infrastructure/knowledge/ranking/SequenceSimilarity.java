package com.knowledgechain.infrastructure.knowledge.ranking;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ratcliff/Obershelp "gestalt pattern matching" ratio: {@code 2 * M / (|a| + |b|)} where M is the
 * number of characters in matching blocks found by recursively taking the longest common substring.
 * <p>
 * There is no "popular character" junk heuristic: on texts of 200+ characters, frequent letters
 * still match, so long snippets score higher than they would with the heuristic on.
 * </p>
 */
final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    static int matchingCharacters(String a, String b) {
        int matches = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});
        while (!ranges.isEmpty()) {
            int[] r = ranges.pop();
            int[] block = longestCommonBlock(a, r[0], r[1], b, r[2], r[3]);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matches += size;
            int i = block[0];
            int j = block[1];
            if (r[0] < i && r[2] < j) {
                ranges.push(new int[]{r[0], i, r[2], j});
            }
            if (i + size < r[1] && j + size < r[3]) {
                ranges.push(new int[]{i + size, r[1], j + size, r[3]});
            }
        }
        return matches;
    }

    /**
     * Longest common substring of a[aLo, aHi) and b[bLo, bHi); the earliest one in {@code a} wins ties.
     *
     * @return {start in a, start in b, length}
     */
    private static int[] longestCommonBlock(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        int[] current = new int[width + 1];
        for (int i = aLo; i < aHi; i++) {
            char c = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                int col = j - bLo + 1;
                if (c == b.charAt(j)) {
                    int run = previous[col - 1] + 1;
                    current[col] = run;
                    if (run > bestSize) {
                        bestSize = run;
                        bestI = i - run + 1;
                        bestJ = j - run + 1;
                    }
                } else {
                    current[col] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
