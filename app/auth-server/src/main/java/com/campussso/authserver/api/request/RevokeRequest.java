package com.campussso.authserver.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RevokeRequest(String token, String clientId, String clientSecret) {

  public static RevokeRequest fromForm(Map<String, String> form) {
    return new RevokeRequest(form.get("token"), form.get("client_id"), form.get("client_secret"));
  }

  @Override
  public String toString() {
    return "RevokeRequest[clientId=" + clientId + "]";
  }
}
