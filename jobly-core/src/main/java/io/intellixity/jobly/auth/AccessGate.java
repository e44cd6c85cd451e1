package io.intellixity.jobly.auth;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Guards evaluated before a repository call.
 * <p>
 * Each guard returns the caller on success so it can be chained with
 * {@link Result#flatMap(java.util.function.Function)}; a failure must short-circuit the operation.
 */
public final class AccessGate {
  private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

  private AccessGate() {}

  public static Result<Caller> requireAuthenticated(Caller caller) {
    Objects.requireNonNull(caller, "caller");
    if (caller.isAnonymous()) {
      log.debug("jobly.gate denied reason=anonymous");
      return Result.failure(ErrorKind.UNAUTHORIZED, "Authentication required");
    }
    return Result.success(caller);
  }

  public static Result<Caller> requireAdmin(Caller caller) {
    return requireAuthenticated(caller).flatMap(c -> {
      if (c.isAdmin()) return Result.success(c);
      log.debug("jobly.gate denied reason=not_admin caller={}", c.identifier());
      return Result.failure(ErrorKind.FORBIDDEN, "Admin privileges required");
    });
  }

  public static Result<Caller> requireAdminOrSelf(Caller caller, String targetIdentifier) {
    return requireAuthenticated(caller).flatMap(c -> {
      if (c.isAdmin() || c.identifier().equals(targetIdentifier)) return Result.success(c);
      log.debug("jobly.gate denied reason=not_admin_or_self caller={} target={}", c.identifier(), targetIdentifier);
      return Result.failure(ErrorKind.FORBIDDEN, "Not permitted to act on '" + targetIdentifier + "'", targetIdentifier);
    });
  }
}
