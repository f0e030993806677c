package com.rsl.retrieval.relevance;

import java.util.List;
import java.util.Locale;

/**
 * Keyword and position score in [0, 1]. Each matched term adds {@code 1 - firstIndex/length};
 * the result is {@code 0.7 * matched/total + 0.3 * positionSum/total}.
 */
public final class LexicalScorer {
    private static final double TERM_WEIGHT = 0.7;
    private static final double POSITION_WEIGHT = 0.3;

    private LexicalScorer() {
    }

    public static double score(String query, String content) {
        List<String> terms = QueryTerms.split(query);
        if (terms.isEmpty() || content == null || content.isEmpty()) {
            return 0.0;
        }
        String contentLower = content.toLowerCase(Locale.ROOT);
        int matched = 0;
        double positionSum = 0.0;
        for (String term : terms) {
            int position = contentLower.indexOf(term);
            if (position >= 0) {
                matched++;
                positionSum += 1.0 - ((double) position / contentLower.length());
            }
        }
        double termScore = (double) matched / terms.size();
        double positionBonus = positionSum / terms.size();
        return Math.min(1.0, termScore * TERM_WEIGHT + positionBonus * POSITION_WEIGHT);
    }
}
