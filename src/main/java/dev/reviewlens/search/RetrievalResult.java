package dev.reviewlens.search;

import java.util.List;

/**
 * Outcome of a hybrid retrieval.
 *
 * @param results ranked reviews, combined score descending, at most top-k, no duplicate ids
 * @param strategy vector search strategy actually used
 * @param candidateCount size of the candidate set after attribute filtering
 */
public record RetrievalResult(
    List<RankedReview> results, RetrievalStrategy strategy, int candidateCount) {

  public RetrievalResult {
    results = List.copyOf(results);
  }

  static RetrievalResult empty(int candidateCount) {
    return new RetrievalResult(List.of(), RetrievalStrategy.NONE, candidateCount);
  }

  /** False when ranking fell back to lexical scores because the vector index failed. */
  public boolean vectorAvailable() {
    return strategy != RetrievalStrategy.LEXICAL_ONLY;
  }
}
