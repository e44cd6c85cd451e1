package io.intellixity.jobly.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A user as exposed to callers; the password hash never leaves the repository.
 * {@code jobs} (ids of jobs applied to) is populated only for the single-user view.
 */
public record User(
    String username,
    String firstName,
    String lastName,
    String email,
    @JsonProperty("isAdmin") boolean isAdmin,
    @JsonInclude(JsonInclude.Include.NON_NULL) List<Integer> jobs
) {
  public User {
    jobs = jobs == null ? null : List.copyOf(jobs);
  }

  public User(String username, String firstName, String lastName, String email, boolean isAdmin) {
    this(username, firstName, lastName, email, isAdmin, null);
  }

  public User withJobs(List<Integer> jobs) {
    return new User(username, firstName, lastName, email, isAdmin, jobs);
  }
}
