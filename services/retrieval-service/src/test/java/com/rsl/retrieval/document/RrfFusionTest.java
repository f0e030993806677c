package com.rsl.retrieval.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RrfFusionTest {

    @Test
    void topRankInOneListContributesOneOverSixtyOne() {
        List<RrfFusion.Candidate> fused = RrfFusion.fuse(List.of("a"), List.of(), RrfFusion.DEFAULT_K, 1.0, 1.0);

        assertEquals(1, fused.size());
        assertEquals(1.0 / 61.0, fused.get(0).getScore(), 1e-12);
        assertEquals(0, fused.get(0).getLexicalRank());
        assertNull(fused.get(0).getSemanticRank());
    }

    @Test
    void weightsScaleEachListContribution() {
        List<RrfFusion.Candidate> fused = RrfFusion.fuse(List.of("a"), List.of("b"), 60, 0.4, 0.6);

        assertEquals("b", fused.get(0).getDocId());
        assertEquals(0.6 / 61.0, fused.get(0).getScore(), 1e-12);
        assertEquals(0.4 / 61.0, fused.get(1).getScore(), 1e-12);
    }

    @Test
    void consensusHitsOutrankSingleListHits() {
        List<RrfFusion.Candidate> fused = RrfFusion.fuse(
            List.of("solo-lex", "both"),
            List.of("solo-sem", "both"),
            60,
            1.0,
            1.0
        );

        assertEquals("both", fused.get(0).getDocId());
        for (RrfFusion.Candidate candidate : fused.subList(1, fused.size())) {
            assertTrue(fused.get(0).getScore() >= candidate.getScore());
        }
    }

    @Test
    void onlyRankOrderMatters() {
        List<RrfFusion.Candidate> first = RrfFusion.fuse(List.of("x", "y", "z"), List.of("z", "x"), 60, 0.4, 0.6);
        List<RrfFusion.Candidate> second = RrfFusion.fuse(List.of("x", "y", "z"), List.of("z", "x"), 60, 0.4, 0.6);

        assertEquals(
            first.stream().map(RrfFusion.Candidate::getDocId).toList(),
            second.stream().map(RrfFusion.Candidate::getDocId).toList()
        );
    }

    @Test
    void tiesBreakOnDocumentId() {
        List<RrfFusion.Candidate> fused = RrfFusion.fuse(List.of("b"), List.of("a"), 60, 1.0, 1.0);

        assertEquals("a", fused.get(0).getDocId());
        assertEquals("b", fused.get(1).getDocId());
    }

    @Test
    void duplicateIdsCountOncePerList() {
        List<RrfFusion.Candidate> fused = RrfFusion.fuse(List.of("a", "a"), List.of(), 60, 1.0, 1.0);

        assertEquals(1, fused.size());
        assertEquals(1.0 / 61.0, fused.get(0).getScore(), 1e-12);
    }

    @Test
    void displayScoreIsCappedAtOne() {
        RrfFusion.Candidate candidate = new RrfFusion.Candidate("a", 0.5, 0, 0);

        assertEquals(1.0, candidate.getDisplayScore(), 1e-12);
        assertEquals(0.5, new RrfFusion.Candidate("b", 0.05, 0, null).getDisplayScore(), 1e-12);
    }
}
