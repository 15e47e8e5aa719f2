/*
 * どこで: auth-server ドメインモデル
 * 何を: 1 回のコード交換から派生する access/refresh token の系譜
 * なぜ: refresh token の再利用検知時に系譜全体を一括で無効化するため
 */
package com.campussso.authserver.model;

import java.time.Instant;

public record TokenFamily(
    String familyId,
    String subjectId,
    String clientId,
    String scope,
    UserRole role,
    String boundFingerprint,
    Instant createdAt,
    FamilyState state) {

  public boolean isActive() {
    return state == FamilyState.ACTIVE;
  }

  public boolean isBound() {
    return boundFingerprint != null && !boundFingerprint.isBlank();
  }

  public TokenFamily revoke() {
    return new TokenFamily(
        familyId, subjectId, clientId, scope, role, boundFingerprint, createdAt, FamilyState.REVOKED);
  }
}
