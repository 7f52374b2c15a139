package com.codeheadsystems.portal.model.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/users/{id}/reset-password}.
 *
 * @param password  the new password
 * @param temporary whether the user must change it at next login
 */
public record ResetPasswordRequest(
    @JsonProperty("password") String password,
    @JsonProperty("temporary") boolean temporary) {

  @Override
  public String toString() {
    return "ResetPasswordRequest[temporary=" + temporary + "]";
  }
}
