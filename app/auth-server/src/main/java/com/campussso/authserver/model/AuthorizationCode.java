/*
 * どこで: auth-server ドメインモデル
 * 何を: 一度だけ交換できる認可コード
 * なぜ: PENDING -> CONSUMED の遷移以外を表現できないようにするため
 */
package com.campussso.authserver.model;

import java.time.Instant;

public record AuthorizationCode(
    String code,
    String clientId,
    String redirectUri,
    String subjectId,
    String scope,
    String certificateFingerprint,
    Instant issuedAt,
    Instant expiresAt,
    CodeState state) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public AuthorizationCode consume() {
    if (state != CodeState.PENDING) {
      throw new IllegalStateException("authorization code is already consumed");
    }
    return new AuthorizationCode(
        code,
        clientId,
        redirectUri,
        subjectId,
        scope,
        certificateFingerprint,
        issuedAt,
        expiresAt,
        CodeState.CONSUMED);
  }

  @Override
  public String toString() {
    return "AuthorizationCode[clientId="
        + clientId
        + ", subjectId="
        + subjectId
        + ", state="
        + state
        + "]";
  }
}
