package dev.reviewlens.review;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Categorical review fields usable as filter predicates.
 *
 * <p>{@link #metadataKey()} is the key the attribute is stored under in vector index metadata.
 */
public enum ReviewAttribute {
  BRANCH("branch"),
  REVIEWER_LOCATION("reviewer_location"),
  RATING("rating"),
  YEAR_MONTH("year_month");

  private final String metadataKey;

  ReviewAttribute(String metadataKey) {
    this.metadataKey = metadataKey;
  }

  public String metadataKey() {
    return metadataKey;
  }

  /**
   * Parses a filter attribute name case-insensitively. Accepts both the enum name and the metadata
   * key ({@code "reviewer_location"}, {@code "REVIEWER_LOCATION"}, {@code "Reviewer-Location"}).
   *
   * @param value the raw attribute name
   * @return the matching attribute, or null if unknown or blank
   */
  public static @Nullable ReviewAttribute parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String key = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (ReviewAttribute attribute : values()) {
      if (attribute.name().equals(key)) {
        return attribute;
      }
    }
    return null;
  }
}
