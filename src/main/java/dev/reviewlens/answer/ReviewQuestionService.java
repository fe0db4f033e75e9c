package dev.reviewlens.answer;

import dev.reviewlens.cache.CacheEntry;
import dev.reviewlens.cache.CacheLookup;
import dev.reviewlens.cache.SemanticResultCache;
import dev.reviewlens.review.AttributePredicate;
import dev.reviewlens.review.QueryFilterExtractor;
import dev.reviewlens.search.HybridRetrievalService;
import dev.reviewlens.search.RetrievalProperties;
import dev.reviewlens.search.RetrievalRequest;
import dev.reviewlens.search.RetrievalResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers free-text questions about the review corpus.
 *
 * <p>Flow: semantic cache lookup -> on a miss, infer attribute filters from the question, retrieve
 * with {@link HybridRetrievalService}, generate with {@link AnswerGenerator}, store the answer in
 * the cache. Only answer generation failures reach the caller.
 */
@Service
public class ReviewQuestionService {

  private static final Logger log = LoggerFactory.getLogger(ReviewQuestionService.class);

  private final SemanticResultCache cache;
  private final QueryFilterExtractor filterExtractor;
  private final HybridRetrievalService retrievalService;
  private final AnswerGenerator answerGenerator;
  private final RetrievalProperties retrievalProperties;

  public ReviewQuestionService(
      SemanticResultCache cache,
      QueryFilterExtractor filterExtractor,
      HybridRetrievalService retrievalService,
      AnswerGenerator answerGenerator,
      RetrievalProperties retrievalProperties) {
    this.cache = cache;
    this.filterExtractor = filterExtractor;
    this.retrievalService = retrievalService;
    this.answerGenerator = answerGenerator;
    this.retrievalProperties = retrievalProperties;
  }

  /**
   * Answers a question, from cache when a semantically equivalent question was answered before.
   *
   * @param question the user question
   * @return the answer with retrieval and cache details
   * @throws IllegalArgumentException if the question is null or blank
   * @throws AnswerGenerationException if the chat model fails after retries
   */
  public QueryAnswer ask(String question) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }

    CacheLookup lookup = cache.lookup(question);
    if (lookup.isHit()) {
      CacheEntry entry = lookup.entry();
      return new QueryAnswer(
          question,
          entry.answer(),
          entry.contextCount(),
          true,
          lookup.similarity(),
          entry.question(),
          null);
    }

    List<AttributePredicate> predicates = filterExtractor.extract(question);
    if (!predicates.isEmpty()) {
      log.info("Applying filters {} for question '{}'", predicates, question);
    }
    RetrievalResult retrieval =
        retrievalService.retrieve(
            new RetrievalRequest(question, predicates, retrievalProperties.getTopK()));

    String answer = answerGenerator.generate(question, retrieval.results());
    int contextCount = retrieval.results().size();
    cache.store(question, answer, contextCount, lookup.questionEmbedding());

    log.info(
        "Answered '{}' from {} reviews (strategy={})",
        question,
        contextCount,
        retrieval.strategy().label());
    return new QueryAnswer(
        question, answer, contextCount, false, null, null, retrieval.strategy());
  }
}
