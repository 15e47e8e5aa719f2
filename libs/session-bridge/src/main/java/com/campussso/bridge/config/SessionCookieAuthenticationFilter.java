package com.campussso.bridge.config;

import com.campussso.bridge.model.SsoPrincipal;
import com.campussso.bridge.service.SessionCookieFactory;
import com.campussso.bridge.service.UnauthenticatedException;
import com.campussso.bridge.service.ValidationClient;
import com.campussso.common.security.CertificateFingerprintResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * サイト cookie のローカルセッションを IdP で検証し、SsoPrincipal を SecurityContext に載せる。
 *
 * <p>検証できない場合は何も載せずに後続へ渡し、認可判断は SecurityFilterChain に任せる。
 */
public class SessionCookieAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(SessionCookieAuthenticationFilter.class);

  private final ValidationClient validationClient;
  private final SessionCookieFactory cookieFactory;
  private final CertificateFingerprintResolver fingerprintResolver;

  public SessionCookieAuthenticationFilter(
      ValidationClient validationClient,
      SessionCookieFactory cookieFactory,
      CertificateFingerprintResolver fingerprintResolver) {
    this.validationClient = validationClient;
    this.cookieFactory = cookieFactory;
    this.fingerprintResolver = fingerprintResolver;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String path = request.getRequestURI();
    return path.startsWith("/session/login")
        || path.startsWith("/session/callback")
        || path.startsWith("/session/logout")
        || path.startsWith("/actuator/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String sessionId = readSessionCookie(request);
    if (sessionId == null) {
      filterChain.doFilter(request, response);
      return;
    }

    try {
      final SsoPrincipal principal =
          validationClient.authenticate(
              sessionId, fingerprintResolver.resolve(request).orElse(null));
      final List<SimpleGrantedAuthority> authorities =
          List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().toUpperCase(Locale.ROOT)));
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(principal, null, authorities);
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } catch (UnauthenticatedException ex) {
      logger.debug("session cookie not accepted: {}", ex.getMessage());
      if (ex.sessionEnded()) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString());
      }
    }
    filterChain.doFilter(request, response);
  }

  private String readSessionCookie(HttpServletRequest request) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (cookieFactory.cookieName().equals(cookie.getName())
          && cookie.getValue() != null
          && !cookie.getValue().isBlank()) {
        return cookie.getValue();
      }
    }
    return null;
  }
}
