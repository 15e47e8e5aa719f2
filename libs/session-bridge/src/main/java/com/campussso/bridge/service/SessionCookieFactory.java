package com.campussso.bridge.service;

import com.campussso.bridge.config.BridgeProperties;
import com.campussso.bridge.model.LocalSession;
import com.campussso.bridge.model.LoginState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/** サイト専用 cookie。値はローカルセッション id のみで、token は含めない。 */
@Component
@RequiredArgsConstructor
public class SessionCookieFactory {

  public static final String LOGIN_BINDING_SUFFIX = "_LOGIN";
  static final String CALLBACK_PATH = "/session/callback";

  private final BridgeProperties properties;
  private final Clock clock;

  public String cookieName() {
    return properties.cookieName();
  }

  public ResponseCookie sessionCookie(LocalSession session) {
    final Duration maxAge =
        Duration.between(Instant.now(clock), session.tokens().refreshExpiresAt());
    return base(session.sessionId()).maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge).build();
  }

  public ResponseCookie clearedCookie() {
    return base("").maxAge(Duration.ZERO).build();
  }

  public String loginBindingCookieName() {
    return properties.cookieName() + LOGIN_BINDING_SUFFIX;
  }

  /** callback パスにだけ送られる、state の有効期限までの短命 cookie。 */
  public ResponseCookie loginBindingCookie(LoginState loginState) {
    final Duration maxAge = Duration.between(Instant.now(clock), loginState.expiresAt());
    return loginBase(loginState.browserBinding())
        .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
        .build();
  }

  public ResponseCookie clearedLoginBindingCookie() {
    return loginBase("").maxAge(Duration.ZERO).build();
  }

  private ResponseCookie.ResponseCookieBuilder base(String value) {
    return attributes(ResponseCookie.from(cookieName(), value)).path("/");
  }

  private ResponseCookie.ResponseCookieBuilder loginBase(String value) {
    return attributes(ResponseCookie.from(loginBindingCookieName(), value)).path(CALLBACK_PATH);
  }

  private ResponseCookie.ResponseCookieBuilder attributes(
      ResponseCookie.ResponseCookieBuilder builder) {
    return builder
        .httpOnly(true)
        .secure(properties.cookieSecure())
        .sameSite("Lax");
  }
}
