package com.campussso.authserver.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PasswordChangeRequest(
    @NotBlank(message = "current_password is required") String currentPassword,
    @NotBlank(message = "new_password is required") String newPassword) {

  @Override
  public String toString() {
    return "PasswordChangeRequest[]";
  }
}
