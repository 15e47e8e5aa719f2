package com.campussso.bridge.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidateTokenResponse(
    String subject,
    String role,
    String scope,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("expires_in") long expiresIn) {}
