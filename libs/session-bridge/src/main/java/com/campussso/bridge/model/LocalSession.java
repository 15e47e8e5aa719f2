package com.campussso.bridge.model;

import java.time.Instant;

public record LocalSession(String sessionId, String clientId, HeldTokens tokens, Instant createdAt) {

  /** refresh token の期限を過ぎたセッションは復旧できない。 */
  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(tokens.refreshExpiresAt());
  }

  public LocalSession withTokens(HeldTokens newTokens) {
    return new LocalSession(sessionId, clientId, newTokens, createdAt);
  }

  @Override
  public String toString() {
    return "LocalSession[clientId=" + clientId + ", subject=" + tokens.subject() + "]";
  }
}
