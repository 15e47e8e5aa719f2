package com.campussso.authserver.api.response;

import com.campussso.authserver.model.TokenPair;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenResponse(
    String accessToken,
    String refreshToken,
    String tokenType,
    long expiresIn,
    long refreshExpiresIn,
    String subject,
    String scope) {

  public static TokenResponse from(TokenPair pair, Instant now) {
    return new TokenResponse(
        pair.accessToken(),
        pair.refreshToken(),
        "Bearer",
        secondsUntil(now, pair.accessExpiresAt()),
        secondsUntil(now, pair.refreshExpiresAt()),
        pair.subjectId(),
        pair.scope());
  }

  static long secondsUntil(Instant now, Instant expiresAt) {
    return Math.max(0, Duration.between(now, expiresAt).getSeconds());
  }

  @Override
  public String toString() {
    return "TokenResponse[subject=" + subject + ", scope=" + scope + "]";
  }
}
