package dev.reviewlens.answer;

import dev.reviewlens.search.RetrievalStrategy;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of answering a question.
 *
 * @param question the question as asked
 * @param answer the generated or cached answer
 * @param contextCount number of reviews the answer was generated from
 * @param cached true if the answer came from the semantic cache
 * @param cacheSimilarity similarity to the cached question on a hit, null otherwise
 * @param originalQuestion the cached question that matched, null on a miss
 * @param strategy retrieval strategy used, null when served from cache
 */
public record QueryAnswer(
    String question,
    String answer,
    int contextCount,
    boolean cached,
    @Nullable Double cacheSimilarity,
    @Nullable String originalQuestion,
    @Nullable RetrievalStrategy strategy) {}
