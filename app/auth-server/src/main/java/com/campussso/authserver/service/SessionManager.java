/*
 * どこで: auth-server サービス層
 * 何を: 利用者を認証して SSO セッションを発行・参照・破棄する
 * なぜ: ブラウザ単位のログイン状態を IdP 側だけで管理し、認可コード発行の前提にするため
 */
package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.SsoSession;
import com.campussso.authserver.model.UserRecord;
import com.campussso.authserver.repository.SsoSessionRepository;
import com.campussso.common.security.CertificateFingerprintResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionManager {

  private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

  private final CredentialStore credentialStore;
  private final SsoSessionRepository sessionRepository;
  private final OpaqueTokenGenerator tokenGenerator;
  private final SsoProperties properties;
  private final SsoMetrics metrics;
  private final Clock clock;

  /**
   * 役割:
   * - パスワードと任意の証明書 fingerprint で利用者を認証し、SSO セッションを作る。
   *
   * 期待動作:
   * - fingerprint が束縛済みかつ提示されている場合のみ照合し、不一致は CERTIFICATE_MISMATCH。
   * - 同じ subject の既存セッションは新しいセッションで置き換える。
   */
  public SsoSession login(String username, String password, String presentedFingerprint) {
    final UserRecord user;
    try {
      user = credentialStore.verify(username, password);
    } catch (SsoException ex) {
      metrics.recordLoginResult("invalid_credentials");
      logger.info("login rejected reason=invalid_credentials");
      throw ex;
    }
    final String presented = CertificateFingerprintResolver.normalize(presentedFingerprint);
    if (user.hasBoundCertificate()
        && presented != null
        && !CertificateFingerprintResolver.matches(user.certificateFingerprint(), presented)) {
      metrics.recordLoginResult("certificate_mismatch");
      logger.warn("login rejected subject={} reason=certificate_mismatch", user.subjectId());
      throw new SsoException(
          SsoException.Reason.CERTIFICATE_MISMATCH, "client certificate does not match");
    }
    final Instant now = Instant.now(clock);
    final SsoSession session =
        new SsoSession(
            tokenGenerator.next(),
            user.subjectId(),
            now,
            now.plus(properties.session().ttl()),
            presented);
    sessionRepository.replaceForSubject(session);
    metrics.recordLoginResult("success");
    logger.info(
        "login succeeded subject={} certificatePresented={}", user.subjectId(), presented != null);
    return session;
  }

  public String currentSubject(String sessionId) {
    return requireSession(sessionId).subjectId();
  }

  /** 有効な SSO セッションを返す。無い、または期限切れなら NO_SESSION。 */
  public SsoSession requireSession(String sessionId) {
    return findActive(sessionId)
        .orElseThrow(() -> new SsoException(SsoException.Reason.NO_SESSION, "login required"));
  }

  public boolean hasActiveSession(String sessionId) {
    return findActive(sessionId).isPresent();
  }

  public void logout(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return;
    }
    sessionRepository.deleteById(sessionId);
  }

  private Optional<SsoSession> findActive(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      return Optional.empty();
    }
    final Optional<SsoSession> session = sessionRepository.findById(sessionId);
    if (session.isEmpty()) {
      return Optional.empty();
    }
    if (session.get().isExpiredAt(Instant.now(clock))) {
      sessionRepository.deleteById(sessionId);
      return Optional.empty();
    }
    return session;
  }
}
