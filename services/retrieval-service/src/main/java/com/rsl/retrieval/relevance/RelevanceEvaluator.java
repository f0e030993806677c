package com.rsl.retrieval.relevance;

import com.rsl.retrieval.search.SearchResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Blends component scores, applies recency decay and title boosting, then filters and ranks.
 * Stateless apart from its configuration; the decay origin is supplied per call.
 */
@Component
public class RelevanceEvaluator {
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final RelevanceProperties properties;

    public RelevanceEvaluator(RelevanceProperties properties) {
        this.properties = properties;
    }

    public double combineScores(double fullTextScore, double semanticScore) {
        return fullTextScore * properties.getFullTextWeight() + semanticScore * properties.getSemanticWeight();
    }

    public double applyTimeDecay(double score, Instant updatedAt, Instant decayOrigin) {
        if (updatedAt == null || decayOrigin == null) {
            return score;
        }
        double daysSince = Math.max(0.0, (decayOrigin.toEpochMilli() - updatedAt.toEpochMilli()) / MILLIS_PER_DAY);
        double decay = decayFactor(daysSince);
        return score * (1.0 + (properties.getRecentBoost() - 1.0) * decay);
    }

    public double decayFactor(double daysSince) {
        double halfLife = properties.getHalfLifeDays() <= 0 ? 1.0 : properties.getHalfLifeDays();
        return Math.exp(-Math.log(2) * Math.max(0.0, daysSince) / halfLife);
    }

    public double applyTitleBoost(double score, List<String> queryTerms, String title) {
        if (queryTerms == null || queryTerms.isEmpty() || title == null) {
            return score;
        }
        String titleLower = title.toLowerCase(Locale.ROOT);
        int matched = 0;
        for (String term : queryTerms) {
            if (titleLower.contains(term.toLowerCase(Locale.ROOT))) {
                matched++;
            }
        }
        if (matched == 0) {
            return score;
        }
        double ratio = (double) matched / queryTerms.size();
        return score * (1.0 + (properties.getTitleBoost() - 1.0) * ratio);
    }

    public double calculateFinalScore(
        double fullTextScore,
        double semanticScore,
        Instant updatedAt,
        String title,
        List<String> queryTerms,
        Instant decayOrigin
    ) {
        double score = combineScores(fullTextScore, semanticScore);
        score = applyTimeDecay(score, updatedAt, decayOrigin);
        score = applyTitleBoost(score, queryTerms, title);
        return Math.min(1.0, Math.max(0.0, score));
    }

    public List<SearchResult> filterAndRank(List<SearchResult> results, List<String> queryTerms, Instant decayOrigin) {
        return filterAndRank(results, queryTerms, decayOrigin, properties.getMinScore());
    }

    /**
     * Rescores copies of {@code results}, drops those under {@code max(minScore, floor)}, sorts
     * descending (stable) and caps at {@code maxResults}.
     */
    public List<SearchResult> filterAndRank(
        List<SearchResult> results,
        List<String> queryTerms,
        Instant decayOrigin,
        double floor
    ) {
        double minScore = Math.max(properties.getMinScore(), floor);
        List<SearchResult> scored = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            double lexical = firstPresent(result.getLexicalScore(), result.getSemanticScore(), result.getRelevanceScore());
            double semantic = firstPresent(result.getSemanticScore(), result.getLexicalScore(), result.getRelevanceScore());
            double score = calculateFinalScore(
                lexical,
                semantic,
                result.getUpdatedAt(),
                result.getTitle(),
                queryTerms,
                decayOrigin
            );
            if (score >= minScore) {
                scored.add(result.withRelevanceScore(score));
            }
        }
        scored.sort(Comparator.comparingDouble(SearchResult::getRelevanceScore).reversed());
        int max = Math.max(0, properties.getMaxResults());
        return scored.size() > max ? new ArrayList<>(scored.subList(0, max)) : scored;
    }

    // a result carrying a single score uses it for both components
    private double firstPresent(Double own, Double other, double fallback) {
        if (own != null) {
            return own;
        }
        return other != null ? other : fallback;
    }
}
