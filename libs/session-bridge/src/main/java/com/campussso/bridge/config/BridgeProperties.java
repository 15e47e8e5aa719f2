/*
 * どこで: リソースサーバー共通の session bridge 設定
 * 何を: client 資格情報・IdP のエンドポイント・cookie・タイムアウトを保持する
 * なぜ: academic-api と cloud-api が同じ実装を設定値だけ変えて使えるようにするため
 */
package com.campussso.bridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sso.bridge")
public record BridgeProperties(
    String clientId,
    String clientSecret,
    String redirectUri,
    String scope,
    String authorizeEndpoint,
    String authServerBaseUrl,
    String tokenPath,
    String validatePath,
    String revokePath,
    String cookieName,
    Boolean cookieSecure,
    String postLoginRedirect,
    String failureRedirect,
    Duration connectTimeout,
    Duration readTimeout,
    String sslBundle,
    Duration stateTtl,
    boolean trustForwardedCertificateHeaders,
    Retention retention) {

  public BridgeProperties {
    clientId = clientId == null ? "" : clientId;
    clientSecret = clientSecret == null ? "" : clientSecret;
    redirectUri = redirectUri == null ? "" : redirectUri;
    scope = scope == null ? "" : scope;
    authServerBaseUrl =
        authServerBaseUrl == null || authServerBaseUrl.isBlank()
            ? "https://sso.localhost:5000"
            : authServerBaseUrl;
    authorizeEndpoint =
        authorizeEndpoint == null || authorizeEndpoint.isBlank()
            ? authServerBaseUrl + "/oauth/authorize"
            : authorizeEndpoint;
    tokenPath = tokenPath == null || tokenPath.isBlank() ? "/oauth/token" : tokenPath;
    validatePath =
        validatePath == null || validatePath.isBlank() ? "/oauth/validate" : validatePath;
    revokePath = revokePath == null || revokePath.isBlank() ? "/oauth/revoke" : revokePath;
    cookieName = cookieName == null || cookieName.isBlank() ? "SITE_SESSION" : cookieName;
    cookieSecure = cookieSecure == null ? Boolean.TRUE : cookieSecure;
    postLoginRedirect =
        postLoginRedirect == null || postLoginRedirect.isBlank() ? "/" : postLoginRedirect;
    failureRedirect =
        failureRedirect == null || failureRedirect.isBlank()
            ? "/?login_error=1"
            : failureRedirect;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
    sslBundle = sslBundle == null || sslBundle.isBlank() ? null : sslBundle;
    stateTtl = stateTtl == null ? Duration.ofMinutes(5) : stateTtl;
    retention = retention == null ? new Retention(false, null) : retention;
  }

  public record Retention(boolean enabled, Duration cleanupInterval) {

    public Retention {
      cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(1) : cleanupInterval;
    }
  }

  @Override
  public String toString() {
    return "BridgeProperties[clientId=" + clientId + ", authServerBaseUrl=" + authServerBaseUrl + "]";
  }
}
