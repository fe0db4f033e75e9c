package dev.reviewlens.review;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Mapping between {@link Review} and the LangChain4j {@link TextSegment} stored in the vector
 * index.
 *
 * <p>The review id travels as the {@value #REVIEW_ID} metadata key, which is what id-restricted
 * searches filter on. Embedding ids are name-based UUIDs derived from the review id so that
 * re-indexing the same corpus upserts instead of duplicating.
 */
public final class ReviewSegments {

  /** Metadata key holding the review id. */
  public static final String REVIEW_ID = "review_id";

  private ReviewSegments() {}

  /**
   * Builds the text segment for a review with its filterable attributes as metadata.
   *
   * @param review the review to convert
   * @return a segment carrying the review text and metadata
   */
  public static TextSegment toTextSegment(Review review) {
    Metadata metadata = Metadata.from(REVIEW_ID, review.id());
    for (ReviewAttribute attribute : ReviewAttribute.values()) {
      String value = review.attribute(attribute);
      if (value != null) {
        metadata.put(attribute.metadataKey(), value);
      }
    }
    return TextSegment.from(review.text(), metadata);
  }

  /**
   * Deterministic embedding id for a review.
   *
   * @param review the review
   * @return UUID string derived from the review id
   */
  public static String embeddingId(Review review) {
    return UUID.nameUUIDFromBytes(review.id().getBytes(StandardCharsets.UTF_8)).toString();
  }

  /**
   * Reads the review id back from a vector index match.
   *
   * @param match the match returned by the index
   * @return the review id, or null when the match carries no segment or no id
   */
  public static @Nullable String reviewId(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    if (segment == null) {
      return null;
    }
    return segment.metadata().getString(REVIEW_ID);
  }
}
