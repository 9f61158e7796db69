package com.example.paylog.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword occurrence lookup and span distance shared by the extractors.
 */
final class TextSpans {

    private TextSpans() {
    }

    /**
     * Start offsets of every case-insensitive occurrence of {@code keyword}.
     */
    static List<Integer> occurrences(String lowerText, String keyword) {
        List<Integer> starts = new ArrayList<>();
        String needle = keyword.toLowerCase(Locale.ROOT);
        int from = 0;
        while (true) {
            int idx = lowerText.indexOf(needle, from);
            if (idx < 0) {
                return starts;
            }
            starts.add(idx);
            from = idx + 1;
        }
    }

    /**
     * Character gap between two spans; 0 when they touch or overlap.
     */
    static int gap(int startA, int endA, int startB, int endB) {
        if (endA <= startB) {
            return startB - endA;
        }
        if (endB <= startA) {
            return startA - endB;
        }
        return 0;
    }
}
