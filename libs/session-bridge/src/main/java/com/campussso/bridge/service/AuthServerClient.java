package com.campussso.bridge.service;

import com.campussso.bridge.config.BridgeProperties;
import com.campussso.bridge.service.dto.RevokeTokenRequest;
import com.campussso.bridge.service.dto.TokenSetResponse;
import com.campussso.bridge.service.dto.ValidateTokenRequest;
import com.campussso.bridge.service.dto.ValidateTokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class AuthServerClient {

  private static final Logger logger = LoggerFactory.getLogger(AuthServerClient.class);
  private static final String TOKEN_EXPIRED_ERROR = "token_expired";

  private final RestClient authServerRestClient;
  private final BridgeProperties properties;
  private final ObjectMapper objectMapper;

  public TokenSetResponse exchangeCode(@NonNull String code) {
    final MultiValueMap<String, String> form = clientForm("authorization_code");
    form.add("code", code);
    form.add("redirect_uri", properties.redirectUri());
    return requireTokenSet(call("exchangeCode", () -> postForm(form)));
  }

  public TokenSetResponse refresh(@NonNull String refreshToken) {
    final MultiValueMap<String, String> form = clientForm("refresh_token");
    form.add("refresh_token", refreshToken);
    return requireTokenSet(call("refresh", () -> postForm(form)));
  }

  /**
   * 役割:
   * - access token を IdP に検証させ、本人情報を受け取る。
   *
   * 期待動作:
   * - 期限切れは TOKEN_EXPIRED、それ以外の 4xx は REJECTED。
   * - タイムアウト・接続失敗・不正レスポンスも例外にする（呼び出し側で fail closed）。
   */
  public ValidateTokenResponse validate(@NonNull String accessToken, String fingerprint) {
    final ValidateTokenResponse response =
        call(
            "validate",
            () ->
                authServerRestClient
                    .post()
                    .uri(properties.validatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ValidateTokenRequest(accessToken, fingerprint))
                    .retrieve()
                    .body(ValidateTokenResponse.class));
    if (isBlank(response.subject()) || isBlank(response.role())) {
      logger.warn("auth-server validate response validation failed");
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.INVALID_RESPONSE, "validate response is invalid");
    }
    return response;
  }

  public void revoke(@NonNull String token) {
    call(
        "revoke",
        () ->
            authServerRestClient
                .post()
                .uri(properties.revokePath())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new RevokeTokenRequest(token, properties.clientId(), properties.clientSecret()))
                .retrieve()
                .toBodilessEntity());
  }

  private TokenSetResponse postForm(MultiValueMap<String, String> form) {
    return authServerRestClient
        .post()
        .uri(properties.tokenPath())
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(form)
        .retrieve()
        .body(TokenSetResponse.class);
  }

  private MultiValueMap<String, String> clientForm(String grantType) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", grantType);
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    return form;
  }

  private TokenSetResponse requireTokenSet(TokenSetResponse response) {
    if (isBlank(response.accessToken())
        || isBlank(response.refreshToken())
        || isBlank(response.subject())
        || response.expiresIn() <= 0
        || response.refreshExpiresIn() <= 0) {
      logger.warn("auth-server token response validation failed");
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.INVALID_RESPONSE, "token response is invalid");
    }
    return response;
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      final T response = request.get();
      if (response == null) {
        logger.warn("auth-server {} returned empty body", operation);
        throw new AuthServerIntegrationException(
            AuthServerIntegrationException.Reason.INVALID_RESPONSE, "auth-server response is empty");
      }
      return response;
    } catch (RestClientResponseException ex) {
      final String error = errorCode(ex);
      logger.warn(
          "auth-server {} failed with http status={} error={}",
          operation,
          ex.getStatusCode().value(),
          error);
      if (ex.getStatusCode().is5xxServerError()) {
        throw new AuthServerIntegrationException(
            AuthServerIntegrationException.Reason.BAD_GATEWAY, "auth-server error", ex);
      }
      if (TOKEN_EXPIRED_ERROR.equals(error)) {
        throw new AuthServerIntegrationException(
            AuthServerIntegrationException.Reason.TOKEN_EXPIRED, "access token expired", ex);
      }
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.REJECTED, "auth-server rejected request", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("auth-server {} timed out", operation);
        throw new AuthServerIntegrationException(
            AuthServerIntegrationException.Reason.TIMEOUT, "auth-server request timeout", ex);
      }
      logger.warn("auth-server {} connection failed", operation, ex);
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.BAD_GATEWAY, "auth-server connection failed", ex);
    } catch (AuthServerIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("auth-server {} response parse failed", operation, ex);
      throw new AuthServerIntegrationException(
          AuthServerIntegrationException.Reason.INVALID_RESPONSE,
          "auth-server response parse failed",
          ex);
    }
  }

  private String errorCode(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (isBlank(body)) {
      return "";
    }
    try {
      final JsonNode node = objectMapper.readTree(body);
      return node.path("error").asText("");
    } catch (JsonProcessingException parseError) {
      logger.debug("auth-server error body is not JSON: {}", parseError.getMessage());
      return "";
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
