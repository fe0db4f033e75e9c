package dev.reviewlens.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for hybrid retrieval.
 *
 * <p>Properties are bound from {@code reviewlens.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code lexical-weight} - weight of the lexical score in fusion (default 0.4)
 *   <li>{@code vector-weight} - weight of the vector similarity in fusion (default 0.6)
 *   <li>{@code strategy-multiplier} - candidate count threshold, as a multiple of top-k, at or above
 *       which the vector search is restricted to candidate ids (default 5)
 *   <li>{@code phrase-boost} - multiplier applied when the whole query appears verbatim in a review
 *       (default 1.5, must be greater than 1)
 *   <li>{@code top-k} - number of reviews handed to the answer generator (default 10, bounded [1,
 *       100])
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "reviewlens.search")
public class RetrievalProperties {

  private double lexicalWeight = 0.4;
  private double vectorWeight = 0.6;
  private int strategyMultiplier = 5;
  private double phraseBoost = 1.5;
  private int topK = 10;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (lexicalWeight < 0.0 || lexicalWeight > 1.0) {
      throw new IllegalStateException(
          "reviewlens.search.lexical-weight must be in [0.0, 1.0], got: " + lexicalWeight);
    }
    if (vectorWeight < 0.0 || vectorWeight > 1.0) {
      throw new IllegalStateException(
          "reviewlens.search.vector-weight must be in [0.0, 1.0], got: " + vectorWeight);
    }
    if (strategyMultiplier < 1) {
      throw new IllegalStateException(
          "reviewlens.search.strategy-multiplier must be at least 1, got: " + strategyMultiplier);
    }
    if (phraseBoost <= 1.0) {
      throw new IllegalStateException(
          "reviewlens.search.phrase-boost must be greater than 1.0, got: " + phraseBoost);
    }
    if (topK < 1 || topK > 100) {
      throw new IllegalStateException(
          "reviewlens.search.top-k must be in [1, 100], got: " + topK);
    }
  }

  public double getLexicalWeight() {
    return lexicalWeight;
  }

  public void setLexicalWeight(double lexicalWeight) {
    this.lexicalWeight = lexicalWeight;
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public int getStrategyMultiplier() {
    return strategyMultiplier;
  }

  public void setStrategyMultiplier(int strategyMultiplier) {
    this.strategyMultiplier = strategyMultiplier;
  }

  public double getPhraseBoost() {
    return phraseBoost;
  }

  public void setPhraseBoost(double phraseBoost) {
    this.phraseBoost = phraseBoost;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }
}
