package io.intellixity.jobly.server.web;

import io.intellixity.jobly.auth.AccessGate;
import io.intellixity.jobly.domain.Company;
import io.intellixity.jobly.repository.CompanyRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/companies")
public final class CompanyController {
  static final PatchSchema PATCH = PatchSchema.builder()
      .text("name", 1, 255, false)
      .text("description", 0, 4000, true)
      .integer("numEmployees", 0, true)
      .url("logoUrl", true)
      .build();

  private final CompanyRepository companies;
  private final PayloadValidator validator;

  public CompanyController(CompanyRepository companies, PayloadValidator validator) {
    this.companies = companies;
    this.validator = validator;
  }

  public record CreateCompanyRequest(
      @NotBlank @Size(max = 25) String handle,
      @NotBlank @Size(max = 255) String name,
      @Size(max = 4000) String description,
      @PositiveOrZero Integer numEmployees,
      @URL String logoUrl
  ) {
    Company toCompany() {
      return new Company(handle, name, description, numEmployees, logoUrl);
    }
  }

  @PostMapping
  public ResponseEntity<Map<String, Company>> create(HttpServletRequest http,
                                                     @RequestBody(required = false) CreateCompanyRequest req) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    Company company = companies.create(validator.check(req).orElseThrow().toCompany()).orElseThrow();
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("company", company));
  }

  /** Filters: nameLike, minEmployees, maxEmployees. */
  @GetMapping
  public Map<String, List<Company>> list(@RequestParam Map<String, String> params) {
    return Map.of("companies", companies.findMany(params).orElseThrow());
  }

  @GetMapping("/{handle}")
  public Map<String, Company> get(@PathVariable("handle") String handle) {
    return Map.of("company", companies.findOne(handle).orElseThrow());
  }

  @PatchMapping("/{handle}")
  public Map<String, Company> update(HttpServletRequest http,
                                     @PathVariable("handle") String handle,
                                     @RequestBody(required = false) Map<String, Object> body) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    Map<String, Object> fields = PATCH.check(body).orElseThrow();
    return Map.of("company", companies.update(handle, fields).orElseThrow());
  }

  @DeleteMapping("/{handle}")
  public Map<String, String> delete(HttpServletRequest http, @PathVariable("handle") String handle) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    return Map.of("deleted", companies.remove(handle).orElseThrow());
  }
}
