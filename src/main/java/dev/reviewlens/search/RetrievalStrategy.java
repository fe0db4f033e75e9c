package dev.reviewlens.search;

/** Vector search strategy chosen for a retrieval, reported for observability. */
public enum RetrievalStrategy {

  /** Vector search restricted to the candidate ids (large candidate sets). */
  ID_RESTRICTED("id_filtered"),

  /** Unrestricted vector search, post-filtered to the candidate set (small candidate sets). */
  FULL_SEARCH("full_search"),

  /** Vector index unavailable; ranking used lexical scores only. */
  LEXICAL_ONLY("lexical_only"),

  /** No search performed (invalid input or empty candidate set). */
  NONE("none");

  private final String label;

  RetrievalStrategy(String label) {
    this.label = label;
  }

  /** Stable lowercase name used in logs and tool output. */
  public String label() {
    return label;
  }
}
