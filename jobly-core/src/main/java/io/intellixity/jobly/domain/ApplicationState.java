package io.intellixity.jobly.domain;

import java.util.Locale;

public enum ApplicationState {
  INTERESTED,
  APPLIED,
  ACCEPTED,
  REJECTED;

  /** Value stored in the {@code state} column and exchanged with clients. */
  public String wire() {
    return name().toLowerCase(Locale.ROOT);
  }
}
