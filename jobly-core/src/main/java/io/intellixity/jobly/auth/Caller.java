package io.intellixity.jobly.auth;

import java.util.Objects;

/**
 * Identity of the party invoking an operation, as resolved by the transport layer.
 *
 * @param identifier username; {@code null} only for {@link Role#ANONYMOUS}
 * @param role       resolved role
 */
public record Caller(String identifier, Role role) {
  private static final Caller ANONYMOUS = new Caller(null, Role.ANONYMOUS);

  public Caller {
    Objects.requireNonNull(role, "role");
    if (role == Role.ANONYMOUS) {
      if (identifier != null) throw new IllegalArgumentException("Anonymous caller cannot carry an identifier");
    } else if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Authenticated caller requires an identifier");
    }
  }

  public static Caller anonymous() {
    return ANONYMOUS;
  }

  public static Caller authenticated(String identifier) {
    return new Caller(identifier, Role.AUTHENTICATED);
  }

  public static Caller admin(String identifier) {
    return new Caller(identifier, Role.ADMIN);
  }

  public boolean isAnonymous() { return role == Role.ANONYMOUS; }
  public boolean isAdmin() { return role == Role.ADMIN; }
}
