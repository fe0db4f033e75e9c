package dev.reviewlens.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Static utility deriving cache identifiers from question text. Questions that differ only in case
 * or whitespace map to the same identifier.
 */
public final class QueryHasher {

  /** Number of hex characters kept from the SHA-256 digest. */
  static final int IDENTIFIER_LENGTH = 16;

  private QueryHasher() {
    // utility class
  }

  /**
   * Normalises a question for hashing: trimmed, lowercased, inner whitespace collapsed.
   *
   * @param question the raw question
   * @return the normalised question
   */
  public static String normalize(String question) {
    return question.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }

  /**
   * Computes the cache identifier of a question.
   *
   * @param question the raw question
   * @return the first 16 lowercase hex characters of the SHA-256 of the normalised question
   */
  public static String identifier(String question) {
    return sha256(normalize(question)).substring(0, IDENTIFIER_LENGTH);
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
