package dev.reviewlens.search;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure static utility for fusing lexical and vector scores with a fixed weighted sum.
 *
 * <p>Vector similarities are clamped to {@code [0, 1]}; lexical scores are already bounded by the
 * phrase boost. The two are then combined: {@code combined = lexicalWeight * lexical + vectorWeight
 * * vector}.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
final class ScoreFusion {

  private ScoreFusion() {}

  /**
   * Fuses lexical and vector candidates by review id.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Insert lexical candidates in order, then vector candidates; the first occurrence of an id
   *       fixes its position for tie-breaking
   *   <li>A score missing from one source counts as 0.0
   *   <li>Repeated ids within one source keep their first score
   *   <li>Stable sort by combined score descending, limit to maxResults
   * </ol>
   *
   * @param lexicalResults candidates with a positive lexical score, in candidate order
   * @param vectorResults candidates returned by the vector index, in index order
   * @param lexicalWeight weight of the lexical score
   * @param vectorWeight weight of the vector score
   * @param maxResults maximum number of results to return
   * @return fused scores sorted by combined score descending, no duplicate ids
   */
  static List<FusedScore> fuse(
      List<ScoredCandidate> lexicalResults,
      List<ScoredCandidate> vectorResults,
      double lexicalWeight,
      double vectorWeight,
      int maxResults) {
    if (maxResults <= 0 || (lexicalResults.isEmpty() && vectorResults.isEmpty())) {
      return List.of();
    }

    // Insertion order is the tie-break order
    Map<String, double[]> scores = new LinkedHashMap<>();

    for (ScoredCandidate lc : lexicalResults) {
      scores.putIfAbsent(lc.reviewId(), new double[] {lc.score(), 0.0});
    }

    Set<String> vectorSeen = new HashSet<>();
    for (ScoredCandidate vc : vectorResults) {
      if (!vectorSeen.add(vc.reviewId())) {
        continue;
      }
      scores.computeIfAbsent(vc.reviewId(), id -> new double[] {0.0, 0.0})[1] = clamp(vc.score());
    }

    return scores.entrySet().stream()
        .map(
            e -> {
              double lexical = e.getValue()[0];
              double vector = e.getValue()[1];
              return new FusedScore(
                  e.getKey(), lexical, vector, lexicalWeight * lexical + vectorWeight * vector);
            })
        .sorted(Comparator.comparingDouble(FusedScore::combinedScore).reversed())
        .limit(maxResults)
        .toList();
  }

  private static double clamp(double similarity) {
    if (Double.isNaN(similarity)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, similarity));
  }

  /**
   * Per-id fusion result.
   *
   * @param reviewId the review identifier
   * @param lexicalScore lexical score, 0.0 when absent
   * @param vectorScore normalised vector score, 0.0 when absent
   * @param combinedScore weighted sum of both
   */
  record FusedScore(
      String reviewId, double lexicalScore, double vectorScore, double combinedScore) {}
}
