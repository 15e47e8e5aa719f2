/*
 * どこで: auth-server API
 * 何を: authorize / token / validate / revoke の OAuth エンドポイント
 * なぜ: ブラウザの front-channel とリソースサーバーの back-channel の契約をここで固定するため
 */
package com.campussso.authserver.api;

import com.campussso.authserver.api.request.RevokeRequest;
import com.campussso.authserver.api.request.TokenRequest;
import com.campussso.authserver.api.request.ValidateRequest;
import com.campussso.authserver.api.response.TokenResponse;
import com.campussso.authserver.api.response.ValidateResponse;
import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.AuthorizationCode;
import com.campussso.authserver.model.TokenIntrospection;
import com.campussso.authserver.model.TokenPair;
import com.campussso.authserver.service.AuthorizationCodeIssuer;
import com.campussso.authserver.service.SsoException;
import com.campussso.authserver.service.TokenGrantService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
public class OAuthController {

  private static final Logger logger = LoggerFactory.getLogger(OAuthController.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final AuthorizationCodeIssuer codeIssuer;
  private final TokenGrantService grantService;
  private final SsoProperties properties;
  private final Clock clock;

  /**
   * 役割:
   * - SSO セッションを持つブラウザに認可コードを発行し、client の redirect_uri へ戻す。
   *
   * 期待動作:
   * - client 不明や redirect_uri 不一致はリダイレクトせず 400 を返す。
   * - 未ログインの場合、ログイン画面が設定されていればそこへ、無ければ 401 を返す。
   */
  @GetMapping("/authorize")
  public ResponseEntity<Void> authorize(
      @RequestParam(name = "response_type", required = false) String responseType,
      @RequestParam(name = "client_id", required = false) String clientId,
      @RequestParam(name = "redirect_uri", required = false) String redirectUri,
      @RequestParam(name = "scope", required = false) String scope,
      @RequestParam(name = "state", required = false) String state,
      @CookieValue(name = AuthController.SESSION_COOKIE, required = false) String sessionId,
      HttpServletRequest request) {
    if (!"code".equals(responseType)) {
      throw new SsoException(
          SsoException.Reason.INVALID_REQUEST, "response_type must be code");
    }
    final AuthorizationCode code;
    try {
      code = codeIssuer.issue(sessionId, clientId, redirectUri, scope);
    } catch (SsoException ex) {
      if (ex.reason() == SsoException.Reason.NO_SESSION && properties.loginPageUrl() != null) {
        logger.info("authorize requires login clientId={}", clientId);
        return redirect(loginRedirect(request));
      }
      throw ex;
    }
    final URI location =
        UriComponentsBuilder.fromUriString(code.redirectUri())
            .queryParam("code", code.code())
            .queryParamIfPresent("state", Optional.ofNullable(state))
            .encode()
            .build()
            .toUri();
    return redirect(location);
  }

  @PostMapping(path = "/token", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TokenResponse> tokenJson(@Valid @RequestBody TokenRequest request) {
    return token(request);
  }

  @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<TokenResponse> tokenForm(@RequestParam Map<String, String> form) {
    return token(TokenRequest.fromForm(form));
  }

  /**
   * 役割:
   * - access token を検証し、subject/role/scope を返す。
   *
   * 期待動作:
   * - 本文に access_token が無ければ Authorization: Bearer を使う。
   * - 状態は一切変更しない。
   */
  @PostMapping("/validate")
  public ResponseEntity<ValidateResponse> validate(
      @RequestBody(required = false) ValidateRequest request,
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    String accessToken = request == null ? null : request.accessToken();
    if ((accessToken == null || accessToken.isBlank())
        && authorization != null
        && authorization.startsWith(BEARER_PREFIX)) {
      accessToken = authorization.substring(BEARER_PREFIX.length()).trim();
    }
    final TokenIntrospection introspection =
        grantService.validate(
            accessToken, request == null ? null : request.clientCertFingerprint());
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .body(ValidateResponse.from(introspection, Instant.now(clock)));
  }

  /** 認証済み client に対しては、token の有無にかかわらず 200 を返す。 */
  @PostMapping(path = "/revoke", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Void> revokeJson(@RequestBody RevokeRequest request) {
    grantService.revoke(request.token(), request.clientId(), request.clientSecret());
    return ResponseEntity.ok().build();
  }

  @PostMapping(path = "/revoke", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<Void> revokeForm(@RequestParam Map<String, String> form) {
    return revokeJson(RevokeRequest.fromForm(form));
  }

  private ResponseEntity<TokenResponse> token(TokenRequest request) {
    final String grantType = request.grantType();
    final TokenPair pair;
    if (TokenGrantService.GRANT_AUTHORIZATION_CODE.equals(grantType)) {
      requireText(request.code(), "code");
      pair =
          grantService.exchangeCode(
              request.code(), request.clientId(), request.clientSecret(), request.redirectUri());
    } else if (TokenGrantService.GRANT_REFRESH_TOKEN.equals(grantType)) {
      requireText(request.refreshToken(), "refresh_token");
      pair =
          grantService.refresh(request.refreshToken(), request.clientId(), request.clientSecret());
    } else {
      throw new SsoException(SsoException.Reason.INVALID_REQUEST, "grant_type is not supported");
    }
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .header(HttpHeaders.PRAGMA, "no-cache")
        .body(TokenResponse.from(pair, Instant.now(clock)));
  }

  private URI loginRedirect(HttpServletRequest request) {
    final StringBuilder authorizeUrl = new StringBuilder(request.getRequestURL());
    if (request.getQueryString() != null) {
      authorizeUrl.append('?').append(request.getQueryString());
    }
    return UriComponentsBuilder.fromUriString(properties.loginPageUrl())
        .queryParam("continue", authorizeUrl.toString())
        .encode()
        .build()
        .toUri();
  }

  private ResponseEntity<Void> redirect(URI location) {
    return ResponseEntity.status(302)
        .location(location)
        .cacheControl(CacheControl.noStore())
        .build();
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new SsoException(SsoException.Reason.INVALID_REQUEST, name + " is required");
    }
  }
}
