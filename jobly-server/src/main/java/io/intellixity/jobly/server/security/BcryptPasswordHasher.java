package io.intellixity.jobly.server.security;

import io.intellixity.jobly.domain.PasswordHasher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

public final class BcryptPasswordHasher implements PasswordHasher {
  private final BCryptPasswordEncoder encoder;

  public BcryptPasswordHasher(int strength) {
    this.encoder = new BCryptPasswordEncoder(strength);
  }

  @Override
  public String hash(String rawPassword) {
    return encoder.encode(rawPassword);
  }
}
