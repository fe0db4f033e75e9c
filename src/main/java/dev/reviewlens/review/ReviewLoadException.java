package dev.reviewlens.review;

/** Thrown when the review source cannot be read or decoded. Fails application startup. */
public class ReviewLoadException extends RuntimeException {

  public ReviewLoadException(String message) {
    super(message);
  }

  public ReviewLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
