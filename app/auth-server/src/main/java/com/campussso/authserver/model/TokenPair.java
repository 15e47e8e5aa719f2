package com.campussso.authserver.model;

import java.time.Instant;

public record TokenPair(
    String accessToken,
    String refreshToken,
    String subjectId,
    String clientId,
    String scope,
    Instant accessExpiresAt,
    Instant refreshExpiresAt,
    String boundFingerprint) {

  @Override
  public String toString() {
    return "TokenPair[subjectId="
        + subjectId
        + ", clientId="
        + clientId
        + ", accessExpiresAt="
        + accessExpiresAt
        + "]";
  }
}
