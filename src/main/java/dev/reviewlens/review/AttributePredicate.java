package dev.reviewlens.review;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * A single filter condition on one review attribute.
 *
 * <p>Both the attribute value and the predicate value are normalised before comparison: lowercased
 * and stripped of every non-alphanumeric character, so {@code "Hong_Kong"}, {@code "hong kong"}
 * and {@code "HongKong"} all compare equal.
 *
 * @param attribute the attribute to test
 * @param kind equality or substring match
 * @param value the value to compare against, stored in normalised form
 */
public record AttributePredicate(ReviewAttribute attribute, Kind kind, String value) {

  /** Closed set of supported comparisons. */
  public enum Kind {
    EQUALS,
    CONTAINS
  }

  /** Compact constructor validating input. */
  public AttributePredicate {
    if (attribute == null || kind == null) {
      throw new IllegalArgumentException("Predicate attribute and kind must not be null");
    }
    if (value == null || normalize(value).isEmpty()) {
      throw new IllegalArgumentException("Predicate value must contain alphanumeric characters");
    }
    value = normalize(value);
  }

  public static AttributePredicate equalTo(ReviewAttribute attribute, String value) {
    return new AttributePredicate(attribute, Kind.EQUALS, value);
  }

  public static AttributePredicate contains(ReviewAttribute attribute, String value) {
    return new AttributePredicate(attribute, Kind.CONTAINS, value);
  }

  /**
   * Tests a review against this predicate. A missing attribute value normalises to the empty
   * string and therefore never matches.
   *
   * @param review the review to test
   * @return true if the review satisfies the predicate
   */
  public boolean matches(Review review) {
    String actual = normalize(review.attribute(attribute));
    return switch (kind) {
      case EQUALS -> actual.equals(value);
      case CONTAINS -> actual.contains(value);
    };
  }

  /**
   * Lowercases and removes every character that is not a letter or digit.
   *
   * @param raw the value to normalise, may be null
   * @return the normalised value, empty for null input
   */
  public static String normalize(@Nullable String raw) {
    if (raw == null) {
      return "";
    }
    return raw.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", "");
  }
}
