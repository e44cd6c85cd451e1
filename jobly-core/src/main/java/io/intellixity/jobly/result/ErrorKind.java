package io.intellixity.jobly.result;

/**
 * Failure categories surfaced to the transport boundary.
 * <p>
 * Every kind except {@link #INTERNAL} is caused by the caller and carries a message safe to return to it.
 */
public enum ErrorKind {
  INVALID_INPUT(true),
  INVALID_FILTER_PARAMETER(true),
  MISSING_FILTER_VALUE(true),
  REFERENCE_NOT_FOUND(true),
  DUPLICATE(true),
  NOT_FOUND(true),
  EMPTY_RESULT(true),
  UNAUTHORIZED(true),
  FORBIDDEN(true),
  INTERNAL(false);

  private final boolean clientCaused;

  ErrorKind(boolean clientCaused) {
    this.clientCaused = clientCaused;
  }

  public boolean clientCaused() {
    return clientCaused;
  }
}
