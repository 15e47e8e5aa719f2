/*
 * どこで: auth-server サービス層
 * 何を: SSO セッションから一回限りの認可コードを発行し、client 認証付きで引き換える
 * なぜ: コードの単一使用と client/redirect_uri の束縛を 1 箇所で保証するため
 */
package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.AuthorizationCode;
import com.campussso.authserver.model.CodeRedemption;
import com.campussso.authserver.model.CodeState;
import com.campussso.authserver.model.RegisteredClient;
import com.campussso.authserver.model.SsoSession;
import com.campussso.authserver.repository.AuthorizationCodeRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuthorizationCodeIssuer {

  private static final Logger logger = LoggerFactory.getLogger(AuthorizationCodeIssuer.class);

  private final SessionManager sessionManager;
  private final ClientRegistry clientRegistry;
  private final AuthorizationCodeRepository codeRepository;
  private final OpaqueTokenGenerator tokenGenerator;
  private final SsoProperties properties;
  private final Clock clock;

  /**
   * 役割:
   * - 認証済みセッションに対して client 向けの認可コードを発行する。
   *
   * 期待動作:
   * - client と redirect_uri と scope を先に検証し、その後にセッションを確認する。
   * - 発行したコードは PENDING で保存し、短い TTL を持つ。
   */
  public AuthorizationCode issue(
      String sessionId, String clientId, String redirectUri, String scope) {
    final RegisteredClient client = clientRegistry.require(clientId);
    if (redirectUri == null || !client.redirectUri().equals(redirectUri)) {
      logger.warn("authorize rejected clientId={} reason=redirect_uri_mismatch", clientId);
      throw new SsoException(
          SsoException.Reason.REDIRECT_MISMATCH, "redirect_uri does not match the client");
    }
    final String resolvedScope;
    try {
      resolvedScope = client.resolveScope(scope);
    } catch (IllegalArgumentException ex) {
      throw new SsoException(SsoException.Reason.INVALID_SCOPE, ex.getMessage(), ex);
    }
    final SsoSession session = sessionManager.requireSession(sessionId);
    final Instant now = Instant.now(clock);
    final AuthorizationCode code =
        new AuthorizationCode(
            tokenGenerator.next(),
            client.clientId(),
            redirectUri,
            session.subjectId(),
            resolvedScope,
            session.presentedFingerprint(),
            now,
            now.plus(properties.code().ttl()),
            CodeState.PENDING);
    codeRepository.save(code);
    logger.info(
        "authorization code issued subject={} clientId={} scope={}",
        session.subjectId(),
        clientId,
        resolvedScope);
    return code;
  }

  /**
   * 役割:
   * - 認可コードを client 資格情報付きで一度だけ引き換える。
   *
   * 期待動作:
   * - client 認証に失敗した場合はコードに触れずに CLIENT_AUTH_FAILED。
   * - コードは検証前に不可分に消費する。以降の検証に失敗しても消費済みのまま残る。
   * - 他 client 宛て・期限切れ・消費済み・未知のコードは INVALID_CODE。
   */
  public CodeRedemption redeem(
      String code, String clientId, String clientSecret, String redirectUri) {
    final RegisteredClient client = clientRegistry.authenticate(clientId, clientSecret);
    final AuthorizationCode consumed =
        codeRepository
            .consume(code)
            .orElseThrow(
                () -> {
                  logger.warn("code redemption rejected clientId={} reason=unknown", clientId);
                  return new SsoException(
                      SsoException.Reason.INVALID_CODE, "authorization code is invalid");
                });
    if (!consumed.clientId().equals(client.clientId())) {
      logger.warn("code redemption rejected clientId={} reason=client_mismatch", clientId);
      throw new SsoException(SsoException.Reason.INVALID_CODE, "authorization code is invalid");
    }
    if (consumed.isExpiredAt(Instant.now(clock))) {
      logger.info("code redemption rejected clientId={} reason=expired", clientId);
      throw new SsoException(SsoException.Reason.INVALID_CODE, "authorization code is invalid");
    }
    if (redirectUri == null || !consumed.redirectUri().equals(redirectUri)) {
      logger.warn("code redemption rejected clientId={} reason=redirect_uri_mismatch", clientId);
      throw new SsoException(
          SsoException.Reason.REDIRECT_MISMATCH, "redirect_uri does not match the code");
    }
    return new CodeRedemption(
        consumed.subjectId(),
        consumed.clientId(),
        consumed.scope(),
        consumed.certificateFingerprint());
  }
}
