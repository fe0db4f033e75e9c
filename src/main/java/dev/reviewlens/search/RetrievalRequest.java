package dev.reviewlens.search;

import dev.reviewlens.review.AttributePredicate;
import java.util.List;

/**
 * Domain request for hybrid retrieval.
 *
 * <p>Unlike an HTTP request DTO, a blank query or a non-positive {@code topK} is not rejected here:
 * {@link HybridRetrievalService} answers such requests with an empty result.
 *
 * @param query the question text (null is treated as blank)
 * @param predicates attribute filters combined with AND, empty for no filtering
 * @param topK maximum number of ranked reviews to return
 */
public record RetrievalRequest(String query, List<AttributePredicate> predicates, int topK) {

  /** Compact constructor normalising null inputs. */
  public RetrievalRequest {
    query = query == null ? "" : query;
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
  }

  /** Convenience constructor without filters. */
  public RetrievalRequest(String query, int topK) {
    this(query, List.of(), topK);
  }

  boolean isSearchable() {
    return topK > 0 && !query.isBlank();
  }
}
