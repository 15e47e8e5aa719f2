package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.SsoSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/** IdP の SSO cookie。HttpOnly、SameSite=Lax、IdP のホストにだけ送られる。 */
@Component
@RequiredArgsConstructor
public class SsoCookieFactory {

  private final SsoProperties properties;
  private final Clock clock;

  public String cookieName() {
    return properties.session().cookieName();
  }

  public ResponseCookie sessionCookie(SsoSession session) {
    final Duration maxAge = Duration.between(Instant.now(clock), session.expiresAt());
    return base(session.sessionId()).maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge).build();
  }

  public ResponseCookie clearedCookie() {
    return base("").maxAge(Duration.ZERO).build();
  }

  private ResponseCookie.ResponseCookieBuilder base(String value) {
    return ResponseCookie.from(cookieName(), value)
        .httpOnly(true)
        .secure(properties.session().cookieSecure())
        .sameSite("Lax")
        .path("/");
  }
}
