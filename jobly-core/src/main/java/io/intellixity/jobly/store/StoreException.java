package io.intellixity.jobly.store;

/** Store-level failure: connection loss, unclassified constraint violation, malformed statement. */
public final class StoreException extends RuntimeException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
