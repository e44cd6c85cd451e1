package io.intellixity.jobly.server.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.jobly.auth.AccessGate;
import io.intellixity.jobly.domain.Application;
import io.intellixity.jobly.domain.ApplicationKey;
import io.intellixity.jobly.domain.ApplicationState;
import io.intellixity.jobly.domain.NewUser;
import io.intellixity.jobly.domain.User;
import io.intellixity.jobly.repository.ApplicationRepository;
import io.intellixity.jobly.repository.UserRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Users and, under {@code /users/{username}/jobs/{id}}, their applications. */
@RestController
@RequestMapping("/users")
public final class UserController {
  static final PatchSchema PATCH = PatchSchema.builder()
      .text("firstName", 1, 25, false)
      .text("lastName", 1, 25, false)
      .text("password", 5, 20, false)
      .email("email", 60)
      .build();

  static final PatchSchema APPLICATION_PATCH = PatchSchema.builder()
      .oneOf("state", stateNames())
      .build();

  private final UserRepository users;
  private final ApplicationRepository applications;
  private final PayloadValidator validator;

  public UserController(UserRepository users, ApplicationRepository applications, PayloadValidator validator) {
    this.users = users;
    this.applications = applications;
    this.validator = validator;
  }

  public record CreateUserRequest(
      @NotBlank @Size(max = 25) String username,
      @NotBlank @Size(min = 5, max = 20) String password,
      @NotBlank @Size(max = 25) String firstName,
      @NotBlank @Size(max = 25) String lastName,
      @NotBlank @Email @Size(min = 6, max = 60) String email,
      @JsonProperty("isAdmin") Boolean isAdmin
  ) {
    NewUser toNewUser() {
      return new NewUser(username, password, firstName, lastName, email, Boolean.TRUE.equals(isAdmin));
    }
  }

  public record ApplyRequest(
      @Pattern(regexp = "interested|applied|accepted|rejected") String state
  ) {}

  @PostMapping
  public ResponseEntity<Map<String, User>> create(HttpServletRequest http,
                                                  @RequestBody(required = false) CreateUserRequest req) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    User user = users.create(validator.check(req).orElseThrow().toNewUser()).orElseThrow();
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("user", user));
  }

  /** Filters: usernameLike, emailLike, adminsOnly. */
  @GetMapping
  public Map<String, List<User>> list(HttpServletRequest http, @RequestParam Map<String, String> params) {
    AccessGate.requireAdmin(CallerFilter.callerOf(http)).orElseThrow();
    return Map.of("users", users.findMany(params).orElseThrow());
  }

  @GetMapping("/{username}")
  public Map<String, User> get(HttpServletRequest http, @PathVariable("username") String username) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    return Map.of("user", users.findOne(username).orElseThrow());
  }

  @PatchMapping("/{username}")
  public Map<String, User> update(HttpServletRequest http,
                                  @PathVariable("username") String username,
                                  @RequestBody(required = false) Map<String, Object> body) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    Map<String, Object> fields = PATCH.check(body).orElseThrow();
    return Map.of("user", users.update(username, fields).orElseThrow());
  }

  @DeleteMapping("/{username}")
  public Map<String, String> delete(HttpServletRequest http, @PathVariable("username") String username) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    return Map.of("deleted", users.remove(username).orElseThrow());
  }

  @PostMapping("/{username}/jobs/{id}")
  public ResponseEntity<Map<String, Integer>> apply(HttpServletRequest http,
                                                    @PathVariable("username") String username,
                                                    @PathVariable("id") int jobId,
                                                    @RequestBody(required = false) ApplyRequest req) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    String state = ApplicationState.APPLIED.wire();
    if (req != null) {
      validator.check(req).orElseThrow();
      if (req.state() != null) state = req.state();
    }
    Application created = applications.create(new Application(username, jobId, state)).orElseThrow();
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("applied", created.jobId()));
  }

  @PatchMapping("/{username}/jobs/{id}")
  public Map<String, Application> updateApplication(HttpServletRequest http,
                                                    @PathVariable("username") String username,
                                                    @PathVariable("id") int jobId,
                                                    @RequestBody(required = false) Map<String, Object> body) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    Map<String, Object> fields = APPLICATION_PATCH.check(body).orElseThrow();
    return Map.of("application", applications.update(new ApplicationKey(username, jobId), fields).orElseThrow());
  }

  @DeleteMapping("/{username}/jobs/{id}")
  public Map<String, ApplicationKey> deleteApplication(HttpServletRequest http,
                                                       @PathVariable("username") String username,
                                                       @PathVariable("id") int jobId) {
    AccessGate.requireAdminOrSelf(CallerFilter.callerOf(http), username).orElseThrow();
    return Map.of("deleted", applications.remove(new ApplicationKey(username, jobId)).orElseThrow());
  }

  private static List<String> stateNames() {
    List<String> names = new ArrayList<>();
    for (ApplicationState s : ApplicationState.values()) names.add(s.wire());
    return names;
  }
}
