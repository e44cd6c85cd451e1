package io.intellixity.jobly.result;

import java.util.Objects;

/**
 * A typed failure.
 *
 * @param kind    failure category
 * @param message human readable description
 * @param subject offending field, parameter or identifier; {@code null} when there is none
 */
public record JoblyError(ErrorKind kind, String message, String subject) {
  public JoblyError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static JoblyError of(ErrorKind kind, String message) {
    return new JoblyError(kind, message, null);
  }
}
