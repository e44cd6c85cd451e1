package io.intellixity.jobly.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Application(String username, int jobId, String state) {
  @JsonIgnore
  public ApplicationKey key() {
    return new ApplicationKey(username, jobId);
  }
}
