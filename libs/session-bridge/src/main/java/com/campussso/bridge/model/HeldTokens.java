package com.campussso.bridge.model;

import java.time.Instant;

/** リソースサーバー側に保持する token pair の写し。ブラウザへは渡さない。 */
public record HeldTokens(
    String accessToken,
    String refreshToken,
    String subject,
    String scope,
    Instant accessExpiresAt,
    Instant refreshExpiresAt) {

  @Override
  public String toString() {
    return "HeldTokens[subject=" + subject + ", refreshExpiresAt=" + refreshExpiresAt + "]";
  }
}
