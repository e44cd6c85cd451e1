package io.intellixity.jobly.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A company. {@code jobs} is populated only for the single-company view.
 */
public record Company(
    String handle,
    String name,
    String description,
    Integer numEmployees,
    String logoUrl,
    @JsonInclude(JsonInclude.Include.NON_NULL) List<Job> jobs
) {
  public Company {
    jobs = jobs == null ? null : List.copyOf(jobs);
  }

  public Company(String handle, String name, String description, Integer numEmployees, String logoUrl) {
    this(handle, name, description, numEmployees, logoUrl, null);
  }

  public Company withJobs(List<Job> jobs) {
    return new Company(handle, name, description, numEmployees, logoUrl, jobs);
  }
}
