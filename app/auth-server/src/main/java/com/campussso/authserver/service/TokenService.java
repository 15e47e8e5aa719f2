/*
 * どこで: auth-server サービス層
 * 何を: access/refresh token の発行・検証・ローテーション・失効を行う
 * なぜ: token family 単位で状態遷移を管理し、refresh token の再利用を検知して系譜ごと無効化するため
 */
package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.AccessTokenRecord;
import com.campussso.authserver.model.FamilyState;
import com.campussso.authserver.model.RefreshState;
import com.campussso.authserver.model.RefreshTokenRecord;
import com.campussso.authserver.model.TokenFamily;
import com.campussso.authserver.model.TokenIntrospection;
import com.campussso.authserver.model.TokenPair;
import com.campussso.authserver.model.UserRecord;
import com.campussso.authserver.repository.TokenRepository;
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
public class TokenService {

  private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

  private final TokenRepository tokenRepository;
  private final CredentialStore credentialStore;
  private final OpaqueTokenGenerator tokenGenerator;
  private final SsoProperties properties;
  private final SsoMetrics metrics;
  private final Clock clock;

  /**
   * 役割:
   * - コード引き換え成功時に新しい token family と最初の token pair を作る。
   *
   * 期待動作:
   * - 利用者に束縛済みの fingerprint があればそれを、無ければログイン時に提示された fingerprint を
   *   token に束縛する。
   * - role は発行時点の値を family に固定する。
   */
  public TokenPair issueTokens(
      String subjectId, String clientId, String scope, String presentedFingerprint) {
    final UserRecord user =
        credentialStore
            .findBySubject(subjectId)
            .orElseThrow(
                () ->
                    new SsoException(
                        SsoException.Reason.INVALID_CODE, "authorization code is invalid"));
    final String boundFingerprint =
        user.hasBoundCertificate()
            ? user.certificateFingerprint()
            : CertificateFingerprintResolver.normalize(presentedFingerprint);
    final Instant now = Instant.now(clock);
    final TokenFamily family =
        new TokenFamily(
            tokenGenerator.next(),
            subjectId,
            clientId,
            scope,
            user.role(),
            boundFingerprint,
            now,
            FamilyState.ACTIVE);
    tokenRepository.saveFamily(family);
    final TokenPair pair = mint(family, now);
    logger.info(
        "token family created subject={} clientId={} bound={}",
        subjectId,
        clientId,
        family.isBound());
    return pair;
  }

  /**
   * access token を検証する。状態は変更しない。
   *
   * <p>束縛されていない token に fingerprint が提示された場合は無視する。証明書の照合は期限より先に行い、
   * 証明書を持たない呼び出し元には期限切れを返さない。
   */
  public TokenIntrospection validate(String accessToken, String presentedFingerprint) {
    final AccessTokenRecord record =
        Optional.ofNullable(accessToken)
            .filter(token -> !token.isBlank())
            .flatMap(tokenRepository::findAccessToken)
            .orElseThrow(this::tokenUnknown);
    final TokenFamily family =
        tokenRepository
            .findFamily(record.familyId())
            .filter(TokenFamily::isActive)
            .orElseThrow(this::tokenUnknown);
    if (family.isBound()
        && !CertificateFingerprintResolver.matches(
            family.boundFingerprint(), presentedFingerprint)) {
      logger.warn(
          "token validation rejected subject={} clientId={} reason=certificate_mismatch",
          family.subjectId(),
          family.clientId());
      throw new SsoException(
          SsoException.Reason.CERTIFICATE_MISMATCH, "client certificate does not match");
    }
    if (record.isExpiredAt(Instant.now(clock))) {
      throw new SsoException(SsoException.Reason.TOKEN_EXPIRED, "access token expired");
    }
    return new TokenIntrospection(
        family.subjectId(), family.scope(), family.role(), family.clientId(), record.expiresAt());
  }

  /**
   * 役割:
   * - refresh token をローテーションし、同じ family に新しい token pair を発行する。
   *
   * 期待動作:
   * - ROTATED の token が再提示された場合は family を失効させ REFRESH_REPLAYED。
   * - ローテーションは比較交換で行い、競合に負けた側も再利用として扱う。
   * - 旧 access token は失効させず、期限切れまで有効のまま残す。
   */
  public TokenPair refresh(String refreshToken, String clientId) {
    final RefreshTokenRecord record =
        Optional.ofNullable(refreshToken)
            .filter(token -> !token.isBlank())
            .flatMap(tokenRepository::findRefreshToken)
            .orElseThrow(this::refreshUnknown);
    final TokenFamily family =
        tokenRepository.findFamily(record.familyId()).orElseThrow(this::refreshUnknown);
    if (clientId != null && !family.clientId().equals(clientId)) {
      logger.warn("refresh rejected clientId={} reason=client_mismatch", clientId);
      throw refreshUnknown();
    }
    if (record.state() == RefreshState.ROTATED) {
      throw replayDetected(family);
    }
    if (record.state() == RefreshState.REVOKED || !family.isActive()) {
      throw refreshUnknown();
    }
    final Instant now = Instant.now(clock);
    if (record.isExpiredAt(now)) {
      throw new SsoException(SsoException.Reason.REFRESH_EXPIRED, "refresh token expired");
    }
    if (!tokenRepository.compareAndSetRefreshToken(record, record.rotate())) {
      throw replayDetected(family);
    }
    final TokenPair pair = mint(family, now);
    logger.info(
        "refresh token rotated subject={} clientId={}", family.subjectId(), family.clientId());
    return pair;
  }

  /**
   * access/refresh token のどちらかを受け取り、その family を失効させる。冪等。
   *
   * @param clientId 指定された場合、他 client の token は失効させずに無視する
   */
  public void revoke(String token, String clientId) {
    if (token == null || token.isBlank()) {
      return;
    }
    final Optional<String> familyId =
        tokenRepository
            .findAccessToken(token)
            .map(AccessTokenRecord::familyId)
            .or(() -> tokenRepository.findRefreshToken(token).map(RefreshTokenRecord::familyId));
    if (familyId.isEmpty()) {
      return;
    }
    final Optional<TokenFamily> family = tokenRepository.findFamily(familyId.get());
    if (family.isEmpty()) {
      return;
    }
    if (clientId != null && !family.get().clientId().equals(clientId)) {
      logger.warn("revoke ignored clientId={} reason=client_mismatch", clientId);
      return;
    }
    if (tokenRepository.revokeFamily(familyId.get())) {
      logger.info(
          "token family revoked subject={} clientId={}",
          family.get().subjectId(),
          family.get().clientId());
    }
  }

  private TokenPair mint(TokenFamily family, Instant now) {
    final AccessTokenRecord accessToken =
        new AccessTokenRecord(
            tokenGenerator.next(),
            family.familyId(),
            now,
            now.plus(properties.token().accessTtl()));
    final RefreshTokenRecord refreshToken =
        new RefreshTokenRecord(
            tokenGenerator.next(),
            family.familyId(),
            now,
            now.plus(properties.token().refreshTtl()),
            RefreshState.ACTIVE);
    tokenRepository.saveAccessToken(accessToken);
    tokenRepository.saveRefreshToken(refreshToken);
    return new TokenPair(
        accessToken.token(),
        refreshToken.token(),
        family.subjectId(),
        family.clientId(),
        family.scope(),
        accessToken.expiresAt(),
        refreshToken.expiresAt(),
        family.boundFingerprint());
  }

  private SsoException replayDetected(TokenFamily family) {
    tokenRepository.revokeFamily(family.familyId());
    metrics.recordRefreshReplay();
    logger.warn(
        "refresh token replay detected, family revoked subject={} clientId={}",
        family.subjectId(),
        family.clientId());
    return new SsoException(SsoException.Reason.REFRESH_REPLAYED, "refresh token was reused");
  }

  private SsoException tokenUnknown() {
    return new SsoException(SsoException.Reason.TOKEN_UNKNOWN, "access token is not active");
  }

  private SsoException refreshUnknown() {
    return new SsoException(SsoException.Reason.REFRESH_UNKNOWN, "refresh token is not active");
  }
}
