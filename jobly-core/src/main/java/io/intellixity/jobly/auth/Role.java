package io.intellixity.jobly.auth;

public enum Role {
  ANONYMOUS,
  AUTHENTICATED,
  /** Granted only when the credential explicitly carries the admin claim. */
  ADMIN
}
