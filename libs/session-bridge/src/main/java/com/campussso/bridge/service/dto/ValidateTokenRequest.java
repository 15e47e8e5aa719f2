package com.campussso.bridge.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateTokenRequest(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("client_cert_fingerprint") String clientCertFingerprint) {}
