package io.intellixity.jobly.result;

import java.util.Objects;

/** Raised when a failed {@link Result} is unwrapped at the transport boundary. */
public final class JoblyException extends RuntimeException {
  private final JoblyError error;

  public JoblyException(JoblyError error) {
    super(Objects.requireNonNull(error, "error").message());
    this.error = error;
  }

  public JoblyError error() {
    return error;
  }

  public ErrorKind kind() {
    return error.kind();
  }
}
