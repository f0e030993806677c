package com.rsl.retrieval.index;

public record IndexStats(Coverage documents, Coverage notes) {

    public record Coverage(long total, long indexed, long unindexed) {
        public static Coverage of(long total, long indexed) {
            return new Coverage(total, indexed, total - indexed);
        }
    }
}
