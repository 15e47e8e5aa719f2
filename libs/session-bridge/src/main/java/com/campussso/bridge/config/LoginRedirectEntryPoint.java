package com.campussso.bridge.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 未認証時の応答。
 *
 * <p>ブラウザの画面遷移 (GET + text/html) は /session/login へ、API 呼び出しは 401 を返す。
 */
public class LoginRedirectEntryPoint implements AuthenticationEntryPoint {

  static final String LOGIN_PATH = "/session/login";
  private static final String UNAUTHENTICATED_BODY =
      "{\"error\":\"unauthenticated\",\"error_description\":\"log in again\"}";

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    if (isPageNavigation(request)) {
      final String returnTo =
          request.getQueryString() == null
              ? request.getRequestURI()
              : request.getRequestURI() + "?" + request.getQueryString();
      response.sendRedirect(
          UriComponentsBuilder.fromPath(LOGIN_PATH)
              .queryParam("return_to", returnTo)
              .encode()
              .build()
              .toUriString());
      return;
    }
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().write(UNAUTHENTICATED_BODY);
  }

  private boolean isPageNavigation(HttpServletRequest request) {
    final String accept = request.getHeader("Accept");
    return HttpMethod.GET.matches(request.getMethod())
        && accept != null
        && accept.contains(MediaType.TEXT_HTML_VALUE);
  }
}
