/*
 * どこで: auth-server token endpoint
 * 何を: authorization_code / refresh_token grant の入力を保持する
 * なぜ: form と JSON のどちらで受けても同じ手順で処理するため
 */
package com.campussso.authserver.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenRequest(
    @NotBlank(message = "grant_type is required") String grantType,
    String code,
    String redirectUri,
    String refreshToken,
    String clientId,
    String clientSecret) {

  public static TokenRequest fromForm(Map<String, String> form) {
    return new TokenRequest(
        form.get("grant_type"),
        form.get("code"),
        form.get("redirect_uri"),
        form.get("refresh_token"),
        form.get("client_id"),
        form.get("client_secret"));
  }

  @Override
  public String toString() {
    return "TokenRequest[grantType=" + grantType + ", clientId=" + clientId + "]";
  }
}
