package io.intellixity.jobly.domain;

import java.util.Objects;

public record ApplicationKey(String username, int jobId) {
  public ApplicationKey {
    Objects.requireNonNull(username, "username");
  }

  @Override
  public String toString() {
    return username + "/" + jobId;
  }
}
