package io.intellixity.jobly.domain;

/** Registration data; {@code password} is plain text and hashed before it is stored. */
public record NewUser(String username, String password, String firstName, String lastName, String email,
                      boolean isAdmin) {
  @Override
  public String toString() {
    return "NewUser[username=" + username + ", isAdmin=" + isAdmin + "]";
  }
}
