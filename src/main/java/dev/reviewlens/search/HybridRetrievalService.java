package dev.reviewlens.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.reviewlens.review.Review;
import dev.reviewlens.review.ReviewSegments;
import dev.reviewlens.review.ReviewStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval over the review corpus: attribute filtering, lexical scoring, vector search with
 * selectivity-dependent strategy, and weighted score fusion.
 *
 * <p>Pipeline: filter the {@link ReviewStore} by predicates -> lexical score every candidate ->
 * choose a vector strategy from the candidate count -> query the {@link EmbeddingStore} -> fuse
 * {@code lexicalWeight * lexical + vectorWeight * vector} -> top-k by combined score.
 *
 * <p>Strategy selection, with {@code threshold = topK * strategyMultiplier}:
 *
 * <ul>
 *   <li>{@code candidates >= threshold}: {@link RetrievalStrategy#ID_RESTRICTED}, the index search
 *       is restricted to exactly the candidate ids and asked for {@code 2 * topK} matches
 *   <li>otherwise: {@link RetrievalStrategy#FULL_SEARCH}, an unrestricted search for {@code 3 *
 *       topK} matches, post-filtered to the candidate set
 * </ul>
 *
 * <p>Any failure of the embedding model or the vector index (including an open circuit breaker)
 * degrades to lexical-only ranking over the candidate set; it is logged, never propagated.
 */
@Service
public class HybridRetrievalService {

  private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

  /** Vector matches requested per top-k slot for the id-restricted strategy. */
  static final int ID_RESTRICTED_FETCH_FACTOR = 2;

  /** Vector matches requested per top-k slot for the full-search strategy. */
  static final int FULL_SEARCH_FETCH_FACTOR = 3;

  /**
   * BGE query prefix for asymmetric retrieval. Applied to search queries only, never to the review
   * texts embedded at indexing time.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final ReviewStore reviewStore;
  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final CircuitBreaker vectorIndexCircuitBreaker;
  private final RetrievalProperties properties;
  private final LexicalScorer lexicalScorer;

  public HybridRetrievalService(
      ReviewStore reviewStore,
      EmbeddingModel embeddingModel,
      EmbeddingStore<TextSegment> embeddingStore,
      @Qualifier("vectorIndexCircuitBreaker") CircuitBreaker vectorIndexCircuitBreaker,
      RetrievalProperties properties) {
    this.reviewStore = reviewStore;
    this.embeddingModel = embeddingModel;
    this.embeddingStore = embeddingStore;
    this.vectorIndexCircuitBreaker = vectorIndexCircuitBreaker;
    this.properties = properties;
    this.lexicalScorer = new LexicalScorer(properties.getPhraseBoost());
  }

  /**
   * Retrieves the top-k reviews for a query.
   *
   * @param request query, attribute predicates and top-k
   * @return ranked reviews with the strategy used; empty without touching the vector index when the
   *     query is blank or top-k is not positive
   */
  public RetrievalResult retrieve(RetrievalRequest request) {
    if (!request.isSearchable()) {
      log.debug("Skipping retrieval for blank query or topK={}", request.topK());
      return RetrievalResult.empty(0);
    }

    List<Review> candidates = reviewStore.filter(request.predicates());
    if (candidates.isEmpty()) {
      log.info("No reviews match filters {} for query '{}'", request.predicates(), request.query());
      return RetrievalResult.empty(0);
    }

    Map<String, Review> candidatesById = new LinkedHashMap<>();
    for (Review review : candidates) {
      candidatesById.put(review.id(), review);
    }

    List<ScoredCandidate> lexical = scoreLexically(request.query(), candidates);

    RetrievalStrategy strategy = selectStrategy(candidates.size(), request.topK());
    List<ScoredCandidate> vector;
    try {
      vector = searchVectors(request.query(), candidatesById, strategy, request.topK());
    } catch (RuntimeException e) {
      log.warn(
          "Vector search failed ({}), falling back to lexical ranking over {} candidates: {}",
          strategy.label(),
          candidates.size(),
          e.getMessage());
      strategy = RetrievalStrategy.LEXICAL_ONLY;
      vector = List.of();
    }

    List<RankedReview> ranked =
        ScoreFusion.fuse(
                lexical,
                vector,
                properties.getLexicalWeight(),
                properties.getVectorWeight(),
                request.topK())
            .stream()
            .map(
                f ->
                    new RankedReview(
                        candidatesById.get(f.reviewId()),
                        f.lexicalScore(),
                        f.vectorScore(),
                        f.combinedScore()))
            .toList();

    log.debug(
        "Retrieved {} reviews (strategy={}, candidates={}, lexicalHits={}, vectorHits={})",
        ranked.size(),
        strategy.label(),
        candidates.size(),
        lexical.size(),
        vector.size());
    return new RetrievalResult(ranked, strategy, candidates.size());
  }

  /**
   * Chooses the vector strategy for a candidate set size.
   *
   * @param candidateCount number of reviews surviving the attribute filter
   * @param topK requested result count
   * @return {@link RetrievalStrategy#ID_RESTRICTED} when the candidate set is at least {@code topK *
   *     strategyMultiplier}, otherwise {@link RetrievalStrategy#FULL_SEARCH}
   */
  RetrievalStrategy selectStrategy(int candidateCount, int topK) {
    long threshold = (long) topK * properties.getStrategyMultiplier();
    return candidateCount >= threshold
        ? RetrievalStrategy.ID_RESTRICTED
        : RetrievalStrategy.FULL_SEARCH;
  }

  /** {@code factor * topK}, saturated at {@link Integer#MAX_VALUE}. */
  static int fetchSize(int factor, int topK) {
    return (int) Math.min((long) factor * topK, Integer.MAX_VALUE);
  }

  private List<ScoredCandidate> scoreLexically(String query, List<Review> candidates) {
    List<ScoredCandidate> scored = new ArrayList<>();
    for (Review review : candidates) {
      double score = lexicalScorer.score(query, review.text());
      if (score > 0.0) {
        scored.add(new ScoredCandidate(review.id(), score));
      }
    }
    return scored;
  }

  private List<ScoredCandidate> searchVectors(
      String query, Map<String, Review> candidatesById, RetrievalStrategy strategy, int topK) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query).content();

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding);
    if (strategy == RetrievalStrategy.ID_RESTRICTED) {
      builder
          .maxResults(fetchSize(ID_RESTRICTED_FETCH_FACTOR, topK))
          .filter(metadataKey(ReviewSegments.REVIEW_ID).isIn(candidatesById.keySet()));
    } else {
      builder.maxResults(fetchSize(FULL_SEARCH_FETCH_FACTOR, topK));
    }
    EmbeddingSearchRequest searchRequest = builder.build();

    EmbeddingSearchResult<TextSegment> result =
        vectorIndexCircuitBreaker.executeSupplier(() -> embeddingStore.search(searchRequest));

    List<ScoredCandidate> scored = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : result.matches()) {
      String reviewId = ReviewSegments.reviewId(match);
      if (reviewId == null || reviewStore.findById(reviewId).isEmpty()) {
        log.debug("Dropping vector match {} with unknown review id", match.embeddingId());
        continue;
      }
      if (!candidatesById.containsKey(reviewId)) {
        // post-filter for the unrestricted search
        continue;
      }
      scored.add(new ScoredCandidate(reviewId, match.score()));
    }
    return scored;
  }
}
