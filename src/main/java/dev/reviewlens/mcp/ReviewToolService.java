package dev.reviewlens.mcp;

import dev.reviewlens.answer.QueryAnswer;
import dev.reviewlens.answer.ReviewQuestionService;
import dev.reviewlens.cache.CacheStats;
import dev.reviewlens.cache.SemanticResultCache;
import dev.reviewlens.review.AttributePredicate;
import dev.reviewlens.review.Review;
import dev.reviewlens.review.ReviewAttribute;
import dev.reviewlens.search.HybridRetrievalService;
import dev.reviewlens.search.RankedReview;
import dev.reviewlens.search.RetrievalRequest;
import dev.reviewlens.search.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing question answering, review search and cache administration as tools.
 *
 * <p>Registered via {@link McpToolConfig}. Tool methods never throw: every exception is caught and
 * returned as a descriptive error string.
 *
 * <p>Tools: {@code ask_reviews}, {@code search_reviews}, {@code cache_stats}, {@code clear_cache}.
 */
@Service
public class ReviewToolService {

  private static final Logger log = LoggerFactory.getLogger(ReviewToolService.class);

  static final int DEFAULT_MAX_RESULTS = 10;
  static final int MAX_RESULTS_LIMIT = 100;
  private static final int EXCERPT_CHARS = 300;

  private final ReviewQuestionService questionService;
  private final HybridRetrievalService retrievalService;
  private final SemanticResultCache cache;

  public ReviewToolService(
      ReviewQuestionService questionService,
      HybridRetrievalService retrievalService,
      SemanticResultCache cache) {
    this.questionService = questionService;
    this.retrievalService = retrievalService;
    this.cache = cache;
  }

  /** Answers a question from the reviews, using the semantic cache when possible. */
  @Tool(
      name = "ask_reviews",
      description =
          "Answer a question about theme parks from customer reviews. "
              + "Mentions of a park (Paris, California, Hong Kong) narrow the reviews used.")
  public String askReviews(
      @ToolParam(description = "Question about the parks") @Nullable String question) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty.";
      }
      QueryAnswer answer = questionService.ask(question);
      StringBuilder sb = new StringBuilder(answer.answer()).append("\n\n");
      if (answer.cached()) {
        sb.append(
            String.format(
                "(cached answer, similarity %.4f to: %s)",
                answer.cacheSimilarity(), answer.originalQuestion()));
      } else {
        sb.append(
            String.format(
                "(based on %d reviews, strategy: %s)",
                answer.contextCount(), answer.strategy().label()));
      }
      return sb.toString();
    } catch (Exception e) {
      log.warn("ask_reviews failed for '{}': {}", question, e.getMessage());
      return "Error answering question: " + e.getMessage();
    }
  }

  /** Ranks reviews for a query with optional attribute filters, without generating an answer. */
  @Tool(
      name = "search_reviews",
      description =
          "Search customer reviews with hybrid keyword and semantic ranking. "
              + "Returns review excerpts with their lexical, vector and combined scores.")
  public String searchReviews(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Filter by park branch, e.g. 'Paris'", required = false)
          @Nullable String branch,
      @ToolParam(description = "Filter by reviewer location, e.g. 'Australia'", required = false)
          @Nullable String reviewerLocation,
      @ToolParam(
              description =
                  "Comma-separated exact-match filters as attribute=value, e.g. 'rating=5,year_month=2019-4'. "
                      + "Attributes: branch, reviewer_location, rating, year_month.",
              required = false)
          @Nullable String filters,
      @ToolParam(description = "Maximum number of results (1-100, default 10)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      List<AttributePredicate> predicates = new ArrayList<>();
      if (branch != null && !branch.isBlank()) {
        predicates.add(AttributePredicate.contains(ReviewAttribute.BRANCH, branch));
      }
      if (reviewerLocation != null && !reviewerLocation.isBlank()) {
        predicates.add(
            AttributePredicate.contains(ReviewAttribute.REVIEWER_LOCATION, reviewerLocation));
      }
      predicates.addAll(parseFilters(filters));
      RetrievalResult result =
          retrievalService.retrieve(
              new RetrievalRequest(query, predicates, clampMaxResults(maxResults)));
      if (result.results().isEmpty()) {
        return predicates.isEmpty()
            ? "No reviews found for query: " + query
            : "No reviews found for query: " + query + " (filters: " + predicates + ")";
      }
      return formatResults(result);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      return "Error searching reviews: " + e.getMessage();
    }
  }

  /** Reports the live entry count and age bounds of the semantic cache. */
  @Tool(
      name = "cache_stats",
      description = "Show semantic answer cache statistics: entries, age range, threshold, TTL.")
  public String cacheStats() {
    try {
      CacheStats stats = cache.stats();
      return String.format(
          "Entries: %d%nOldest: %s%nNewest: %s%nSimilarity threshold: %.2f%nTTL: %s",
          stats.entryCount(),
          stats.oldestEntry() != null ? stats.oldestEntry().toString() : "none",
          stats.newestEntry() != null ? stats.newestEntry().toString() : "none",
          stats.similarityThreshold(),
          stats.ttl());
    } catch (Exception e) {
      return "Error reading cache statistics: " + e.getMessage();
    }
  }

  /** Drops every cached answer. */
  @Tool(name = "clear_cache", description = "Remove all cached answers.")
  public String clearCache() {
    try {
      cache.clear();
      return "Cache cleared.";
    } catch (Exception e) {
      return "Error clearing cache: " + e.getMessage();
    }
  }

  private String formatResults(RetrievalResult result) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "%d results from %d candidates (strategy: %s)%n",
            result.results().size(), result.candidateCount(), result.strategy().label()));
    int rank = 1;
    for (RankedReview ranked : result.results()) {
      Review review = ranked.review();
      sb.append(
          String.format(
              "%n%d. [%s] %s | rating %s | %s | combined %.3f (lexical %.3f, vector %.3f)%n%s%n",
              rank++,
              review.id(),
              review.branch(),
              review.rating(),
              review.reviewerLocation(),
              ranked.combinedScore(),
              ranked.lexicalScore(),
              ranked.vectorScore(),
              excerpt(review.text())));
    }
    return sb.toString();
  }

  static List<AttributePredicate> parseFilters(@Nullable String filters) {
    if (filters == null || filters.isBlank()) {
      return List.of();
    }
    List<AttributePredicate> predicates = new ArrayList<>();
    for (String clause : filters.split(",")) {
      if (clause.isBlank()) {
        continue;
      }
      int eq = clause.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException(
            "Invalid filter '%s'. Use attribute=value.".formatted(clause.trim()));
      }
      String name = clause.substring(0, eq).trim();
      ReviewAttribute attribute = ReviewAttribute.parse(name);
      if (attribute == null) {
        throw new IllegalArgumentException(
            "Unknown filter attribute '%s'. Use branch, reviewer_location, rating or year_month."
                .formatted(name));
      }
      predicates.add(AttributePredicate.equalTo(attribute, clause.substring(eq + 1)));
    }
    return predicates;
  }

  private static String excerpt(String text) {
    return text.length() <= EXCERPT_CHARS ? text : text.substring(0, EXCERPT_CHARS) + "...";
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return DEFAULT_MAX_RESULTS;
    }
    return Math.min(maxResults, MAX_RESULTS_LIMIT);
  }
}
