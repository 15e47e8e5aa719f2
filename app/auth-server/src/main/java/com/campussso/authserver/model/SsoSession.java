/*
 * どこで: auth-server ドメインモデル
 * 何を: IdP 側のログイン済みセッション
 * なぜ: authorize 時に「ログイン済みであること」を証明する唯一の根拠にするため
 */
package com.campussso.authserver.model;

import java.time.Instant;

public record SsoSession(
    String sessionId,
    String subjectId,
    Instant issuedAt,
    Instant expiresAt,
    String presentedFingerprint) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "SsoSession[subjectId=" + subjectId + ", expiresAt=" + expiresAt + "]";
  }
}
