package io.intellixity.jobly.server.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.junit.jupiter.api.Assertions.*;

final class BcryptPasswordHasherTest {

  @Test
  void hashIsSaltedAndVerifiable() {
    BcryptPasswordHasher hasher = new BcryptPasswordHasher(4);
    String a = hasher.hash("password1");
    String b = hasher.hash("password1");

    assertNotEquals("password1", a);
    assertNotEquals(a, b);
    assertTrue(new BCryptPasswordEncoder().matches("password1", a));
  }
}
