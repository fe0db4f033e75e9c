package dev.reviewlens.review;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory collection of every review, addressable by id.
 *
 * <p>Built once at startup and never mutated afterwards, so a single instance is shared across
 * request threads without locking. Iteration order is the load order of the source. Filtering
 * preserves it, so lexical candidates reach ranking in load order; ties between them keep that
 * order, and reviews found only by the vector index rank after tied lexical candidates.
 */
public final class ReviewStore {

  private final List<Review> reviews;
  private final Map<String, Review> byId;

  /**
   * Creates a store over the given reviews. Duplicate ids keep their first occurrence.
   *
   * @param reviews the reviews in source order
   */
  public ReviewStore(List<Review> reviews) {
    Map<String, Review> index = new LinkedHashMap<>();
    for (Review review : reviews) {
      index.putIfAbsent(review.id(), review);
    }
    this.byId = Collections.unmodifiableMap(index);
    this.reviews = List.copyOf(index.values());
  }

  /**
   * Returns the candidate set for the given predicates (logical AND over the whole store).
   *
   * @param predicates zero or more attribute predicates
   * @return matching reviews in store order; the full store when no predicates are given
   */
  public List<Review> filter(List<AttributePredicate> predicates) {
    return filter(reviews, predicates);
  }

  /**
   * Applies predicates to an arbitrary review list. Filtering an already-filtered list with the
   * same predicates returns the same list.
   *
   * @param source the reviews to filter, order preserved
   * @param predicates zero or more attribute predicates
   * @return reviews from {@code source} satisfying every predicate
   */
  public List<Review> filter(List<Review> source, List<AttributePredicate> predicates) {
    if (predicates.isEmpty()) {
      return source;
    }
    List<Review> matching = new ArrayList<>();
    for (Review review : source) {
      if (matchesAll(review, predicates)) {
        matching.add(review);
      }
    }
    return Collections.unmodifiableList(matching);
  }

  public Optional<Review> findById(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  public List<Review> all() {
    return reviews;
  }

  public int size() {
    return reviews.size();
  }

  private static boolean matchesAll(Review review, List<AttributePredicate> predicates) {
    for (AttributePredicate predicate : predicates) {
      if (!predicate.matches(review)) {
        return false;
      }
    }
    return true;
  }
}
