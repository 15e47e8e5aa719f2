package com.campussso.bridge.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RevokeTokenRequest(
    String token,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret) {

  @Override
  public String toString() {
    return "RevokeTokenRequest[clientId=" + clientId + "]";
  }
}
