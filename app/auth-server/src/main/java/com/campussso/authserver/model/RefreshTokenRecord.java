/*
 * どこで: auth-server ドメインモデル
 * 何を: refresh token とそのローテーション状態
 * なぜ: ROTATED 済み token の再提示を replay として判定するため
 */
package com.campussso.authserver.model;

import java.time.Instant;

public record RefreshTokenRecord(
    String token, String familyId, Instant issuedAt, Instant expiresAt, RefreshState state) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public RefreshTokenRecord rotate() {
    if (state != RefreshState.ACTIVE) {
      throw new IllegalStateException("only an active refresh token can be rotated");
    }
    return new RefreshTokenRecord(token, familyId, issuedAt, expiresAt, RefreshState.ROTATED);
  }

  @Override
  public String toString() {
    return "RefreshTokenRecord[familyId=" + familyId + ", state=" + state + "]";
  }
}
