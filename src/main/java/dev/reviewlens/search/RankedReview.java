package dev.reviewlens.search;

import dev.reviewlens.review.Review;

/**
 * A review with its fused relevance score.
 *
 * @param review the matched review
 * @param lexicalScore token-overlap score (0.0 if no overlap)
 * @param vectorScore vector similarity in [0, 1] (0.0 if not returned by the index)
 * @param combinedScore weighted fusion of both scores, the ranking key
 */
public record RankedReview(
    Review review, double lexicalScore, double vectorScore, double combinedScore) {}
