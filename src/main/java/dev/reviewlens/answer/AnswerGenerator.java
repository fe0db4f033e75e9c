package dev.reviewlens.answer;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.reviewlens.review.Review;
import dev.reviewlens.search.RankedReview;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Produces a natural-language answer from retrieved reviews with the configured {@link ChatModel}.
 *
 * <p>Every ranked review becomes a numbered context block; the model is instructed to answer only
 * from those blocks. Transient model failures are retried with exponential backoff; once retries
 * are exhausted the failure surfaces as {@link AnswerGenerationException}.
 */
@Service
public class AnswerGenerator {

  private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);

  static final String SYSTEM_PROMPT =
      "You are a helpful assistant that answers questions about theme parks "
          + "based on customer reviews. Use only the provided reviews to answer. "
          + "If the reviews don't contain enough information, say so.";

  static final String NO_CONTEXT = "No relevant reviews found.";

  /** Maximum review characters included per context block. */
  static final int MAX_REVIEW_CHARS = 500;

  private static final String BLOCK_SEPARATOR = "\n---\n";

  private final ChatModel chatModel;

  public AnswerGenerator(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  /**
   * Generates an answer to the question grounded in the given reviews.
   *
   * @param question the user question
   * @param reviews ranked context reviews, possibly empty
   * @return the model's answer
   * @throws AnswerGenerationException if the model call fails
   */
  @Retryable(
      retryFor = AnswerGenerationException.class,
      maxAttemptsExpression = "${reviewlens.chat.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${reviewlens.chat.retry.delay-ms:1000}",
              multiplierExpression = "${reviewlens.chat.retry.multiplier:2.0}"))
  public String generate(String question, List<RankedReview> reviews) {
    log.info("Querying chat model with {} reviews as context", reviews.size());
    List<ChatMessage> messages =
        List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPrompt(question, reviews)));
    try {
      String answer = chatModel.chat(messages).aiMessage().text();
      return Objects.requireNonNullElse(answer, "");
    } catch (RuntimeException e) {
      log.warn("Chat model call failed: {}", e.getMessage());
      throw new AnswerGenerationException("Answer generation failed: " + e.getMessage(), e);
    }
  }

  static String userPrompt(String question, List<RankedReview> reviews) {
    return "Based on these customer reviews:\n\n"
        + buildContext(reviews)
        + "\n\nQuestion: "
        + question
        + "\n\nPlease provide a concise answer based on the reviews above.";
  }

  static String buildContext(List<RankedReview> reviews) {
    if (reviews.isEmpty()) {
      return NO_CONTEXT;
    }
    List<String> blocks = new ArrayList<>(reviews.size());
    int index = 1;
    for (RankedReview ranked : reviews) {
      Review review = ranked.review();
      blocks.add(
          "Review "
              + index++
              + ":\n"
              + "Park: "
              + orUnknown(review.branch())
              + "\nRating: "
              + orUnknown(review.rating())
              + "\nDate: "
              + orUnknown(review.yearMonth())
              + "\nReviewer Location: "
              + orUnknown(review.reviewerLocation())
              + "\nReview: "
              + truncate(review.text())
              + "\n");
    }
    return String.join(BLOCK_SEPARATOR, blocks);
  }

  private static String truncate(String text) {
    return text.length() <= MAX_REVIEW_CHARS ? text : text.substring(0, MAX_REVIEW_CHARS);
  }

  private static String orUnknown(@Nullable String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }
}
