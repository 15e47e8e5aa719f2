package com.campussso.authserver.api.response;

import com.campussso.authserver.model.UserRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserResponse(
    String subject, String username, String role, boolean certificateBound) {

  public static UserResponse from(UserRecord user) {
    return new UserResponse(
        user.subjectId(), user.username(), user.role().wireValue(), user.hasBoundCertificate());
  }
}
