package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/users}.
 *
 * @param username  the login name, required
 * @param email     the email address
 * @param firstName the given name
 * @param lastName  the family name
 * @param enabled   whether the account starts enabled; defaults to true
 * @param password  optional initial password, set as temporary
 */
public record CreateUserRequest(
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "CreateUserRequest[username=" + username + ", email=" + email + "]";
  }
}
