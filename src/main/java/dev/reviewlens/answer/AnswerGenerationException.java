package dev.reviewlens.answer;

/** Thrown when the chat model cannot produce an answer, after retries are exhausted. */
public class AnswerGenerationException extends RuntimeException {

  public AnswerGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
