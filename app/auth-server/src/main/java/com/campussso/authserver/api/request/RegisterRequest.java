package com.campussso.authserver.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterRequest(
    @NotBlank(message = "username is required") String username,
    @NotBlank(message = "password is required") String password,
    String role,
    String certFingerprint) {

  @Override
  public String toString() {
    return "RegisterRequest[username=" + username + ", role=" + role + "]";
  }
}
