package dev.reviewlens.review;

import org.jspecify.annotations.Nullable;

/**
 * Immutable visitor review loaded once at startup.
 *
 * @param id stable unique identifier (the source's {@code Review_ID})
 * @param branch park branch the review is about, e.g. {@code Disneyland_Paris}
 * @param reviewerLocation country the reviewer comes from
 * @param rating star rating as given by the source (1-5)
 * @param yearMonth visit month as {@code YYYY-M}, or {@code missing}
 * @param text free-text review body
 */
public record Review(
    String id,
    @Nullable String branch,
    @Nullable String reviewerLocation,
    @Nullable String rating,
    @Nullable String yearMonth,
    String text) {

  /** Compact constructor validating the identity fields. */
  public Review {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Review id must not be blank");
    }
    if (text == null) {
      throw new IllegalArgumentException("Review text must not be null");
    }
  }

  /**
   * Returns the value of a categorical attribute.
   *
   * @param attribute the attribute to read
   * @return the raw attribute value, possibly null
   */
  public @Nullable String attribute(ReviewAttribute attribute) {
    return switch (attribute) {
      case BRANCH -> branch;
      case REVIEWER_LOCATION -> reviewerLocation;
      case RATING -> rating;
      case YEAR_MONTH -> yearMonth;
    };
  }
}
