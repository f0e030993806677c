package com.rsl.retrieval.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted reciprocal rank fusion. An item at 0-based rank {@code r} contributes
 * {@code weight / (k + r + 1)}; contributions are summed per id. Only rank order matters.
 */
public final class RrfFusion {
    public static final int DEFAULT_K = 60;

    private RrfFusion() {
    }

    public static List<Candidate> fuse(
        List<String> lexicalRanking,
        List<String> semanticRanking,
        int k,
        double lexicalWeight,
        double semanticWeight
    ) {
        Map<String, MutableCandidate> candidates = new HashMap<>();

        for (int rank = 0; rank < lexicalRanking.size(); rank++) {
            MutableCandidate candidate = candidates.computeIfAbsent(lexicalRanking.get(rank), MutableCandidate::new);
            if (candidate.lexicalRank == null) {
                candidate.lexicalRank = rank;
                candidate.score += contribution(k, rank) * lexicalWeight;
            }
        }

        for (int rank = 0; rank < semanticRanking.size(); rank++) {
            MutableCandidate candidate = candidates.computeIfAbsent(semanticRanking.get(rank), MutableCandidate::new);
            if (candidate.semanticRank == null) {
                candidate.semanticRank = rank;
                candidate.score += contribution(k, rank) * semanticWeight;
            }
        }

        List<MutableCandidate> mutable = new ArrayList<>(candidates.values());
        mutable.sort(
            Comparator.comparingDouble(MutableCandidate::getScore).reversed()
                .thenComparing(MutableCandidate::getDocId)
        );

        List<Candidate> fused = new ArrayList<>(mutable.size());
        for (MutableCandidate candidate : mutable) {
            fused.add(new Candidate(candidate.docId, candidate.score, candidate.lexicalRank, candidate.semanticRank));
        }
        return fused;
    }

    public static double contribution(int k, int rank) {
        return 1.0 / (k + rank + 1);
    }

    public static final class Candidate {
        private final String docId;
        private final double score;
        private final Integer lexicalRank;
        private final Integer semanticRank;

        public Candidate(String docId, double score, Integer lexicalRank, Integer semanticRank) {
            this.docId = docId;
            this.score = score;
            this.lexicalRank = lexicalRank;
            this.semanticRank = semanticRank;
        }

        public String getDocId() {
            return docId;
        }

        public double getScore() {
            return score;
        }

        public Integer getLexicalRank() {
            return lexicalRank;
        }

        public Integer getSemanticRank() {
            return semanticRank;
        }

        /**
         * Fused score scaled into [0, 1] for display.
         */
        public double getDisplayScore() {
            return Math.min(1.0, score * 10.0);
        }
    }

    private static final class MutableCandidate {
        private final String docId;
        private double score;
        private Integer lexicalRank;
        private Integer semanticRank;

        private MutableCandidate(String docId) {
            this.docId = docId;
        }

        private String getDocId() {
            return docId;
        }

        private double getScore() {
            return score;
        }
    }
}
