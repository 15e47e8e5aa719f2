/*
 * どこで: auth-server ドメインモデル
 * 何を: Credential Store が保持する利用者レコード
 * なぜ: パスワードハッシュと証明書 fingerprint の束縛を一箇所で扱うため
 */
package com.campussso.authserver.model;

import java.time.Instant;

public record UserRecord(
    String subjectId,
    String username,
    String passwordHash,
    UserRole role,
    String certificateFingerprint,
    Instant createdAt,
    Instant updatedAt) {

  public boolean hasBoundCertificate() {
    return certificateFingerprint != null && !certificateFingerprint.isBlank();
  }

  public UserRecord withPasswordHash(String newPasswordHash, Instant now) {
    return new UserRecord(
        subjectId, username, newPasswordHash, role, certificateFingerprint, createdAt, now);
  }

  public UserRecord withCertificateFingerprint(String fingerprint, Instant now) {
    return new UserRecord(subjectId, username, passwordHash, role, fingerprint, createdAt, now);
  }

  @Override
  public String toString() {
    return "UserRecord[subjectId=" + subjectId + ", role=" + role + "]";
  }
}
