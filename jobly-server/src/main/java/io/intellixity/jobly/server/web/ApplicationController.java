package io.intellixity.jobly.server.web;

import io.intellixity.jobly.auth.AccessGate;
import io.intellixity.jobly.domain.Application;
import io.intellixity.jobly.repository.ApplicationRepository;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/applications")
public final class ApplicationController {
  private final ApplicationRepository applications;

  public ApplicationController(ApplicationRepository applications) {
    this.applications = applications;
  }

  /** Admin-wide listing. Filters: username, jobId, state. */
  @GetMapping
  public Map<String, List<Application>> list(HttpServletRequest http, @RequestParam Map<String, String> params) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    return Map.of("applications", applications.findMany(params).orElseThrow());
  }
}
