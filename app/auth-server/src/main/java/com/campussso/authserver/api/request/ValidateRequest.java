package com.campussso.authserver.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidateRequest(String accessToken, String clientCertFingerprint) {

  @Override
  public String toString() {
    return "ValidateRequest[fingerprintPresented=" + (clientCertFingerprint != null) + "]";
  }
}
