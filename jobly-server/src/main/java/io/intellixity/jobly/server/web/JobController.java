package io.intellixity.jobly.server.web;

import io.intellixity.jobly.auth.AccessGate;
import io.intellixity.jobly.domain.Job;
import io.intellixity.jobly.domain.NewJob;
import io.intellixity.jobly.repository.JobRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
public final class JobController {
  static final PatchSchema PATCH = PatchSchema.builder()
      .text("title", 1, 255, false)
      .integer("salary", 0, true)
      .decimal("equity", BigDecimal.ZERO, BigDecimal.ONE, true)
      .build();

  private final JobRepository jobs;
  private final PayloadValidator validator;

  public JobController(JobRepository jobs, PayloadValidator validator) {
    this.jobs = jobs;
    this.validator = validator;
  }

  public record CreateJobRequest(
      @NotBlank @Size(max = 255) String title,
      @PositiveOrZero Integer salary,
      @DecimalMin("0") @DecimalMax("1") BigDecimal equity,
      @NotBlank @Size(max = 25) String companyHandle
  ) {
    NewJob toNewJob() {
      return new NewJob(title, salary, equity, companyHandle);
    }
  }

  @PostMapping
  public ResponseEntity<Map<String, Job>> create(HttpServletRequest http,
                                                 @RequestBody(required = false) CreateJobRequest req) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    Job job = jobs.create(validator.check(req).orElseThrow().toNewJob()).orElseThrow();
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("job", job));
  }

  /** Filters: titleLike, minSalary, hasEquity. */
  @GetMapping
  public Map<String, List<Job>> list(@RequestParam Map<String, String> params) {
    return Map.of("jobs", jobs.findMany(params).orElseThrow());
  }

  @GetMapping("/{id}")
  public Map<String, Job> get(@PathVariable("id") int id) {
    return Map.of("job", jobs.findOne(id).orElseThrow());
  }

  @PatchMapping("/{id}")
  public Map<String, Job> update(HttpServletRequest http,
                                 @PathVariable("id") int id,
                                 @RequestBody(required = false) Map<String, Object> body) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    Map<String, Object> fields = PATCH.check(body).orElseThrow();
    return Map.of("job", jobs.update(id, fields).orElseThrow());
  }

  @DeleteMapping("/{id}")
  public Map<String, Integer> delete(HttpServletRequest http, @PathVariable("id") int id) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    return Map.of("deleted", jobs.remove(id).orElseThrow());
  }
}
