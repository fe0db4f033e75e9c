package dev.reviewlens.search;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure token-overlap relevance scorer.
 *
 * <p>{@code score = |queryTokens ∩ textTokens| / |queryTokens|}, multiplied by the phrase boost when
 * the whole (lowercased) query occurs verbatim in the (lowercased) text. The result lies in {@code
 * [0, phraseBoost]}. Queries without word tokens score 0.
 *
 * <p>Stateless and thread-safe.
 */
public final class LexicalScorer {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

  private final double phraseBoost;

  public LexicalScorer(double phraseBoost) {
    if (phraseBoost <= 1.0) {
      throw new IllegalArgumentException("phraseBoost must be greater than 1.0");
    }
    this.phraseBoost = phraseBoost;
  }

  /**
   * Scores a text against a query.
   *
   * @param query the user query
   * @param text the review text
   * @return non-negative relevance score
   */
  public double score(String query, String text) {
    Set<String> queryTokens = tokenize(query);
    if (queryTokens.isEmpty()) {
      return 0.0;
    }
    Set<String> textTokens = tokenize(text);
    long overlap = queryTokens.stream().filter(textTokens::contains).count();
    double base = (double) overlap / queryTokens.size();
    if (text.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT))) {
      return base * phraseBoost;
    }
    return base;
  }

  /**
   * Splits text into its set of lowercase word tokens.
   *
   * @param text the text to tokenize
   * @return distinct tokens in first-seen order
   */
  static Set<String> tokenize(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }
}
