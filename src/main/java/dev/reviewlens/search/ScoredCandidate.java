package dev.reviewlens.search;

/**
 * A review id with its raw score from a single source (lexical or vector). Used as input to
 * {@link ScoreFusion}.
 *
 * @param reviewId review identifier, the deduplication key across sources
 * @param score the source score (token overlap ratio for lexical, relevance for vector)
 */
record ScoredCandidate(String reviewId, double score) {}
