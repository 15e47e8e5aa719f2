/*
 * どこで: session bridge の認証結果
 * 何を: 検証済みの subject/role/scope を業務ハンドラへ渡す principal
 * なぜ: 業務コードが token を一切扱わずに認可判断できるようにするため
 */
package com.campussso.bridge.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.security.core.AuthenticatedPrincipal;

public record SsoPrincipal(String subject, String role, String scope)
    implements AuthenticatedPrincipal {

  @Override
  public String getName() {
    return subject;
  }

  public Set<String> scopes() {
    if (scope == null || scope.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(scope.trim().split("\\s+")).collect(Collectors.toUnmodifiableSet());
  }

  public boolean hasScope(String required) {
    return scopes().contains(required);
  }
}
