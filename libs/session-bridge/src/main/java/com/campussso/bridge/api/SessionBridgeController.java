package com.campussso.bridge.api;

import com.campussso.bridge.model.SsoPrincipal;
import com.campussso.bridge.service.CallbackResult;
import com.campussso.bridge.service.LoginRedirect;
import com.campussso.bridge.service.SessionBridgeService;
import com.campussso.bridge.service.SessionCookieFactory;
import com.campussso.bridge.service.UnauthenticatedException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
public class SessionBridgeController {

  static final String SESSION_COOKIE = "${sso.bridge.cookie-name:SITE_SESSION}";
  static final String LOGIN_BINDING_COOKIE =
      SESSION_COOKIE + SessionCookieFactory.LOGIN_BINDING_SUFFIX;

  private final SessionBridgeService sessionBridgeService;
  private final SessionCookieFactory cookieFactory;

  @GetMapping("/login")
  public ResponseEntity<Void> login(
      @RequestParam(name = "return_to", required = false) String returnTo) {
    final LoginRedirect redirect = sessionBridgeService.startLogin(returnTo);
    return ResponseEntity.status(HttpStatus.FOUND)
        .cacheControl(CacheControl.noStore())
        .location(redirect.authorizeUri())
        .header(
            HttpHeaders.SET_COOKIE,
            cookieFactory.loginBindingCookie(redirect.loginState()).toString())
        .build();
  }

  @GetMapping("/callback")
  public ResponseEntity<Void> callback(
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "error", required = false) String error,
      @CookieValue(name = LOGIN_BINDING_COOKIE, required = false) String browserBinding) {
    final CallbackResult result =
        sessionBridgeService.handleCallback(code, state, error, browserBinding);
    final List<String> cookies = new ArrayList<>();
    if (result.succeeded()) {
      cookies.add(cookieFactory.sessionCookie(result.session()).toString());
    }
    cookies.add(cookieFactory.clearedLoginBindingCookie().toString());
    return ResponseEntity.status(HttpStatus.FOUND)
        .cacheControl(CacheControl.noStore())
        .location(URI.create(result.redirectPath()))
        .header(HttpHeaders.SET_COOKIE, cookies.toArray(String[]::new))
        .build();
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(
      @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
    sessionBridgeService.logout(sessionId);
    return ResponseEntity.noContent()
        .header(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString())
        .build();
  }

  @GetMapping("/me")
  public SessionPrincipalResponse me(@AuthenticationPrincipal SsoPrincipal principal) {
    if (principal == null) {
      throw new UnauthenticatedException("no authenticated principal");
    }
    return SessionPrincipalResponse.from(principal);
  }
}
