package com.campussso.authserver.model;

import java.time.Instant;

public record AccessTokenRecord(String token, String familyId, Instant issuedAt, Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "AccessTokenRecord[familyId=" + familyId + ", expiresAt=" + expiresAt + "]";
  }
}
