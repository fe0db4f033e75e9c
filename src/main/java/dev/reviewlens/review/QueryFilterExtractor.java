package dev.reviewlens.review;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Infers attribute predicates from the wording of a free-text question.
 *
 * <p>Recognises the three park branches and a known reviewer origin. At most one branch predicate
 * is produced; when a question names several parks the first entry in declaration order wins.
 */
@Component
public class QueryFilterExtractor {

  private static final Map<String, String> BRANCH_KEYWORDS = new LinkedHashMap<>();
  private static final Map<String, String> LOCATION_KEYWORDS = new LinkedHashMap<>();

  static {
    BRANCH_KEYWORDS.put("hong kong", "Hong_Kong");
    BRANCH_KEYWORDS.put("california", "California");
    BRANCH_KEYWORDS.put("paris", "Paris");
    LOCATION_KEYWORDS.put("australia", "Australia");
  }

  /**
   * Extracts substring predicates for any park branch or reviewer location named in the question.
   *
   * @param question the user question
   * @return predicates to apply, empty when nothing is recognised
   */
  public List<AttributePredicate> extract(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    List<AttributePredicate> predicates = new ArrayList<>();
    firstMatch(lower, BRANCH_KEYWORDS)
        .forEach(v -> predicates.add(AttributePredicate.contains(ReviewAttribute.BRANCH, v)));
    firstMatch(lower, LOCATION_KEYWORDS)
        .forEach(
            v ->
                predicates.add(
                    AttributePredicate.contains(ReviewAttribute.REVIEWER_LOCATION, v)));
    return predicates;
  }

  private static List<String> firstMatch(String lower, Map<String, String> keywords) {
    for (Map.Entry<String, String> entry : keywords.entrySet()) {
      if (lower.contains(entry.getKey())) {
        return List.of(entry.getValue());
      }
    }
    return List.of();
  }
}
