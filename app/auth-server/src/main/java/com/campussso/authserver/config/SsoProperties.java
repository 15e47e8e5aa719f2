/*
 * どこで: auth-server 設定バインディング
 * 何を: SSO セッション/認可コード/トークンの寿命とクライアント登録、seed 利用者を保持する
 * なぜ: 寿命やクライアント構成を環境ごとに差し替えられるようにするため
 */
package com.campussso.authserver.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sso")
public record SsoProperties(
    Session session,
    Code code,
    Token token,
    String loginPageUrl,
    boolean trustForwardedCertificateHeaders,
    Map<String, Client> clients,
    List<SeedUser> users) {

  public SsoProperties {
    session = session == null ? new Session(null, null, null) : session;
    code = code == null ? new Code(null) : code;
    token = token == null ? new Token(null, null) : token;
    loginPageUrl = loginPageUrl == null || loginPageUrl.isBlank() ? null : loginPageUrl;
    clients = clients == null ? Map.of() : Map.copyOf(clients);
    users = users == null ? List.of() : List.copyOf(users);
  }

  public record Session(String cookieName, Duration ttl, Boolean cookieSecure) {

    public Session {
      cookieName = cookieName == null || cookieName.isBlank() ? "SSO_SESSION" : cookieName;
      ttl = ttl == null ? Duration.ofHours(1) : ttl;
      cookieSecure = cookieSecure == null ? Boolean.TRUE : cookieSecure;
    }
  }

  public record Code(Duration ttl) {

    public Code {
      ttl = ttl == null ? Duration.ofMinutes(5) : ttl;
    }
  }

  public record Token(Duration accessTtl, Duration refreshTtl) {

    public Token {
      accessTtl = accessTtl == null ? Duration.ofMinutes(5) : accessTtl;
      refreshTtl = refreshTtl == null ? Duration.ofHours(1) : refreshTtl;
    }
  }

  public record Client(String secret, String redirectUri, Set<String> scopes) {

    public Client {
      scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }
  }

  public record SeedUser(
      String username, String password, String role, String certFingerprint) {

    @Override
    public String toString() {
      return "SeedUser[username=" + username + ", role=" + role + "]";
    }
  }
}
