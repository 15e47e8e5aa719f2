package com.campussso.authserver.api.response;

import com.campussso.authserver.model.TokenIntrospection;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidateResponse(
    String subject, String role, String scope, String clientId, long expiresIn) {

  public static ValidateResponse from(TokenIntrospection introspection, Instant now) {
    return new ValidateResponse(
        introspection.subjectId(),
        introspection.role().wireValue(),
        introspection.scope(),
        introspection.clientId(),
        TokenResponse.secondsUntil(now, introspection.expiresAt()));
  }
}
