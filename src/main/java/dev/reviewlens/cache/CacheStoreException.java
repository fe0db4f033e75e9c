package dev.reviewlens.cache;

/** Thrown by a {@link CacheStore} when the backing store is unreachable or rejects a command. */
public class CacheStoreException extends RuntimeException {

  public CacheStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
