/*
 * どこで: auth-server ドメインモデル
 * 何を: 固定登録されたリソースサーバー client の定義
 * なぜ: client_id/secret/redirect_uri/scope の照合条件を 1 つの値にまとめるため
 */
package com.campussso.authserver.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record RegisteredClient(
    String clientId, String clientSecret, String redirectUri, Set<String> scopes) {

  public RegisteredClient {
    scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
  }

  /**
   * 要求 scope を許可 scope の範囲に正規化する。
   *
   * @return 空白区切りの scope。要求が空なら許可 scope 全体。
   * @throws IllegalArgumentException 許可されていない scope を含む場合
   */
  public String resolveScope(String requested) {
    if (requested == null || requested.isBlank()) {
      return String.join(" ", scopes.stream().sorted().toList());
    }
    final Set<String> resolved = new LinkedHashSet<>(List.of(requested.trim().split("\\s+")));
    for (String scope : resolved) {
      if (!scopes.contains(scope)) {
        throw new IllegalArgumentException("scope is not allowed: " + scope);
      }
    }
    return String.join(" ", resolved);
  }

  @Override
  public String toString() {
    return "RegisteredClient[clientId=" + clientId + ", redirectUri=" + redirectUri + "]";
  }
}
