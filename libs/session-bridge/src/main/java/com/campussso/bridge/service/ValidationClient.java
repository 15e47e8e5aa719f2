/*
 * どこで: session bridge サービス層
 * 何を: サイト cookie のセッション id から IdP 検証済みの本人を確定する
 * なぜ: 保護 API の前段で一度だけ自動 refresh し、それ以外は再ログインへ倒すため
 */
package com.campussso.bridge.service;

import com.campussso.bridge.model.HeldTokens;
import com.campussso.bridge.model.LocalSession;
import com.campussso.bridge.model.SsoPrincipal;
import com.campussso.bridge.repository.LocalSessionRepository;
import com.campussso.bridge.service.dto.TokenSetResponse;
import com.campussso.bridge.service.dto.ValidateTokenResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ValidationClient {

  private static final Logger logger = LoggerFactory.getLogger(ValidationClient.class);
  private static final int LOCK_STRIPES = 64;

  private final AuthServerClient authServerClient;
  private final LocalSessionRepository localSessionRepository;
  private final BridgeMetrics metrics;
  private final Clock clock;
  private final ReentrantLock[] refreshLocks = newStripes();

  /**
   * 役割:
   * - ローカルセッションの access token を IdP で検証し、(subject, role, scope) を返す。
   *
   * 期待動作:
   * - cookie なし・対応付けなし・refresh 期限切れは UnauthenticatedException。
   * - 期限切れ応答のときだけ refresh を一度行い、保持中の pair を差し替えて再検証する。
   * - refresh 以降の失敗、および IdP の拒否は対応付けを削除する。
   * - タイムアウトなど到達不能時も fail closed だが、対応付けは残す。
   */
  public SsoPrincipal authenticate(String sessionId, String presentedFingerprint) {
    if (sessionId == null || sessionId.isBlank()) {
      throw unauthenticated("no_cookie", "session cookie is missing");
    }
    final LocalSession session =
        localSessionRepository
            .findById(sessionId)
            .orElseThrow(() -> unauthenticated("no_session", "local session not found"));
    if (session.isExpiredAt(Instant.now(clock))) {
      localSessionRepository.deleteById(sessionId);
      throw unauthenticated("expired", "local session expired");
    }

    try {
      final SsoPrincipal principal = validateHeld(session.tokens(), presentedFingerprint);
      metrics.recordValidationResult("success");
      return principal;
    } catch (AuthServerIntegrationException ex) {
      if (ex.reason() != AuthServerIntegrationException.Reason.TOKEN_EXPIRED) {
        throw failClosed(session, ex);
      }
    }
    return refreshAndRetry(session, presentedFingerprint);
  }

  private SsoPrincipal refreshAndRetry(LocalSession stale, String presentedFingerprint) {
    final String sessionId = stale.sessionId();
    final HeldTokens tokens;
    final ReentrantLock lock = lockFor(sessionId);
    lock.lock();
    try {
      final LocalSession current =
          localSessionRepository
              .findById(sessionId)
              .orElseThrow(() -> unauthenticated("no_session", "local session ended"));
      if (current.tokens().equals(stale.tokens())) {
        tokens = rotate(current);
      } else {
        // 別リクエストが先に refresh 済み。
        tokens = current.tokens();
      }
    } finally {
      lock.unlock();
    }

    try {
      final SsoPrincipal principal = validateHeld(tokens, presentedFingerprint);
      metrics.recordValidationResult("refreshed");
      return principal;
    } catch (AuthServerIntegrationException ex) {
      localSessionRepository.deleteById(sessionId);
      logger.warn("validation after refresh failed reason={}", ex.reason());
      throw unauthenticated("retry_failed", "validation failed after refresh", ex);
    }
  }

  private HeldTokens rotate(LocalSession current) {
    final TokenSetResponse refreshed;
    try {
      refreshed = authServerClient.refresh(current.tokens().refreshToken());
    } catch (AuthServerIntegrationException ex) {
      localSessionRepository.deleteById(current.sessionId());
      logger.warn("token refresh failed reason={}", ex.reason());
      throw unauthenticated("refresh_failed", "token refresh failed", ex);
    }
    final LocalSession updated =
        current.withTokens(HeldTokensMapper.toHeldTokens(refreshed, Instant.now(clock)));
    if (!localSessionRepository.replace(current, updated)) {
      throw unauthenticated("no_session", "local session ended during refresh");
    }
    return updated.tokens();
  }

  private SsoPrincipal validateHeld(HeldTokens tokens, String presentedFingerprint) {
    final ValidateTokenResponse response =
        authServerClient.validate(tokens.accessToken(), presentedFingerprint);
    if (!tokens.subject().equals(response.subject())) {
      logger.warn("auth-server returned a subject that does not match the held token pair");
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.REJECTED, "subject mismatch");
    }
    return new SsoPrincipal(response.subject(), response.role(), response.scope());
  }

  private UnauthenticatedException failClosed(
      LocalSession session, AuthServerIntegrationException ex) {
    if (ex.reason() == AuthServerIntegrationException.Reason.REJECTED) {
      localSessionRepository.deleteById(session.sessionId());
      return unauthenticated("rejected", "token rejected by auth-server", ex);
    }
    metrics.recordValidationResult("unavailable");
    return new UnauthenticatedException("auth-server unavailable", false, ex);
  }

  private UnauthenticatedException unauthenticated(String result, String message) {
    metrics.recordValidationResult(result);
    return new UnauthenticatedException(message);
  }

  private UnauthenticatedException unauthenticated(String result, String message, Throwable cause) {
    metrics.recordValidationResult(result);
    return new UnauthenticatedException(message, true, cause);
  }

  private ReentrantLock lockFor(String sessionId) {
    return refreshLocks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
  }

  private static ReentrantLock[] newStripes() {
    final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
    for (int i = 0; i < LOCK_STRIPES; i++) {
      stripes[i] = new ReentrantLock();
    }
    return stripes;
  }
}
