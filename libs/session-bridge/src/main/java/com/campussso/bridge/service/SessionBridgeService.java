/*
 * どこで: session bridge サービス層
 * 何を: authorize へのリダイレクト・callback での code 交換・ログアウトを扱う
 * なぜ: token をサーバー側に閉じ込め、ブラウザにはサイト cookie だけを渡すため
 */
package com.campussso.bridge.service;

import com.campussso.bridge.config.BridgeProperties;
import com.campussso.bridge.model.HeldTokens;
import com.campussso.bridge.model.LocalSession;
import com.campussso.bridge.model.LoginState;
import com.campussso.bridge.repository.LocalSessionRepository;
import com.campussso.bridge.repository.LoginStateRepository;
import com.campussso.bridge.service.dto.TokenSetResponse;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class SessionBridgeService {

  private static final Logger logger = LoggerFactory.getLogger(SessionBridgeService.class);

  private final AuthServerClient authServerClient;
  private final LoginStateRepository loginStateRepository;
  private final LocalSessionRepository localSessionRepository;
  private final SessionIdGenerator idGenerator;
  private final BridgeProperties properties;
  private final BridgeMetrics metrics;
  private final Clock clock;

  /**
   * 役割:
   * - 一回限りの state を発行し、IdP の authorize エンドポイントへの URL を組み立てる。
   *
   * 期待動作:
   * - state には戻り先パスと有効期限、ブラウザ紐付け用の値を持たせる。
   * - 紐付け用の値は URL に載せず、呼び出し側が cookie としてブラウザに渡す。
   * - 戻り先はサイト内の相対パスのみ。それ以外は postLoginRedirect に置き換える。
   */
  public LoginRedirect startLogin(String returnTo) {
    final String state = idGenerator.next();
    final Instant now = Instant.now(clock);
    final LoginState loginState =
        new LoginState(
            state, idGenerator.next(), safeReturnPath(returnTo), now.plus(properties.stateTtl()));
    loginStateRepository.save(loginState);
    final URI authorizeUri =
        UriComponentsBuilder.fromUriString(properties.authorizeEndpoint())
            .queryParam("response_type", "code")
            .queryParam("client_id", properties.clientId())
            .queryParam("redirect_uri", properties.redirectUri())
            .queryParam("scope", properties.scope())
            .queryParam("state", state)
            .encode()
            .build()
            .toUri();
    return new LoginRedirect(authorizeUri, loginState);
  }

  /**
   * 役割:
   * - IdP からの redirect を受け、state を消費して code を back-channel で token に交換する。
   *
   * 期待動作:
   * - state は成否にかかわらず一度で無効になる。
   * - ログインを開始したブラウザの紐付け cookie と一致しない callback は code を交換しない。
   * - どの失敗でもローカルセッションは作らず、failureRedirect を返す。
   */
  public CallbackResult handleCallback(
      String code, String state, String error, String browserBinding) {
    if (isBlank(state)) {
      return fail("missing_parameter");
    }
    final Instant now = Instant.now(clock);
    final Optional<LoginState> loginState = loginStateRepository.consume(state);
    if (loginState.isEmpty() || loginState.get().isExpiredAt(now)) {
      logger.warn("session callback rejected: unknown or expired state");
      return fail("invalid_state");
    }
    if (!loginState.get().isBoundTo(browserBinding)) {
      logger.warn("session callback rejected: state was issued to another browser");
      return fail("binding_mismatch");
    }
    if (!isBlank(error)) {
      logger.warn("session callback received authorization error={}", error);
      return fail("authorization_error");
    }
    if (isBlank(code)) {
      return fail("missing_parameter");
    }

    final TokenSetResponse tokenSet;
    try {
      tokenSet = authServerClient.exchangeCode(code);
    } catch (AuthServerIntegrationException ex) {
      logger.warn("session callback code exchange failed reason={}", ex.reason());
      return fail("exchange_" + ex.reason().name().toLowerCase(Locale.ROOT));
    }

    final Instant receivedAt = Instant.now(clock);
    final HeldTokens tokens = HeldTokensMapper.toHeldTokens(tokenSet, receivedAt);
    final LocalSession session =
        new LocalSession(idGenerator.next(), properties.clientId(), tokens, receivedAt);
    localSessionRepository.save(session);
    metrics.recordCallbackResult("success");
    logger.info("local session established subject={}", tokens.subject());
    return CallbackResult.established(session, loginState.get().returnPath());
  }

  /** 保持していた token family を IdP で失効させ、対応付けを消す。何度呼んでもよい。 */
  public void logout(String sessionId) {
    final Optional<LocalSession> removed = localSessionRepository.deleteById(sessionId);
    if (removed.isEmpty()) {
      return;
    }
    try {
      authServerClient.revoke(removed.get().tokens().refreshToken());
      logger.info("local session ended subject={}", removed.get().tokens().subject());
    } catch (AuthServerIntegrationException ex) {
      logger.warn(
          "token revocation failed on logout reason={}; local session already removed",
          ex.reason());
    }
  }

  private CallbackResult fail(String failure) {
    metrics.recordCallbackResult(failure);
    return CallbackResult.failed(failure, properties.failureRedirect());
  }

  String safeReturnPath(String returnTo) {
    if (isBlank(returnTo)
        || !returnTo.startsWith("/")
        || returnTo.startsWith("//")
        || returnTo.contains("\\")) {
      return properties.postLoginRedirect();
    }
    return returnTo;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
