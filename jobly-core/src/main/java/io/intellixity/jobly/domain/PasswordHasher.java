package io.intellixity.jobly.domain;

/** One-way password hashing, supplied by the hosting application. */
public interface PasswordHasher {
  String hash(String rawPassword);
}
