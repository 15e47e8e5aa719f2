package com.campussso.bridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.campussso.bridge.service.dto.TokenSetResponse;
import com.campussso.bridge.service.dto.ValidateTokenResponse;
import com.campussso.bridge.support.BridgeTestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class AuthServerClientTest {

  private static final String TOKEN_SET =
      """
      {"access_token":"at-1","refresh_token":"rt-1","token_type":"Bearer",
       "expires_in":300,"refresh_expires_in":3600,"subject":"student01",
       "scope":"courses.read grades.read"}
      """;

  @Test
  void exchangeCodePostsFormWithClientCredentials() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/token"))
        .andExpect(method(POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "grant_type", "authorization_code",
                        "code", "code-1",
                        "client_id", "academic-api",
                        "client_secret", "academic-secret",
                        "redirect_uri", BridgeTestProperties.REDIRECT_URI)))
        .andRespond(withSuccess(TOKEN_SET, MediaType.APPLICATION_JSON));

    final TokenSetResponse tokens = fixture.client.exchangeCode("code-1");

    assertThat(tokens.accessToken()).isEqualTo("at-1");
    assertThat(tokens.refreshToken()).isEqualTo("rt-1");
    assertThat(tokens.subject()).isEqualTo("student01");
    assertThat(tokens.refreshExpiresIn()).isEqualTo(3600);
    fixture.server.verify();
  }

  @Test
  void refreshPostsRefreshGrant() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/token"))
        .andExpect(
            content()
                .formDataContains(
                    Map.of("grant_type", "refresh_token", "refresh_token", "rt-1")))
        .andRespond(withSuccess(TOKEN_SET, MediaType.APPLICATION_JSON));

    assertThat(fixture.client.refresh("rt-1").accessToken()).isEqualTo("at-1");
    fixture.server.verify();
  }

  @Test
  void validateSendsAccessTokenAndFingerprint() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.access_token").value("at-1"))
        .andExpect(jsonPath("$.client_cert_fingerprint").value("ab12"))
        .andRespond(
            withSuccess(
                """
                {"subject":"student01","role":"student","scope":"courses.read",
                 "client_id":"academic-api","expires_in":120}
                """,
                MediaType.APPLICATION_JSON));

    final ValidateTokenResponse response = fixture.client.validate("at-1", "ab12");

    assertThat(response.subject()).isEqualTo("student01");
    assertThat(response.role()).isEqualTo("student");
    assertThat(response.clientId()).isEqualTo("academic-api");
    fixture.server.verify();
  }

  @Test
  void validateOmitsFingerprintWhenAbsent() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andExpect(jsonPath("$.client_cert_fingerprint").doesNotExist())
        .andRespond(
            withSuccess(
                "{\"subject\":\"student01\",\"role\":\"student\",\"scope\":\"\"}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.validate("at-1", null).subject()).isEqualTo("student01");
  }

  @Test
  void validateMapsTokenExpiredErrorToTokenExpired() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andRespond(
            withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"token_expired\",\"error_description\":\"expired\"}"));

    assertThatThrownBy(() -> fixture.client.validate("at-1", null))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.TOKEN_EXPIRED);
  }

  @Test
  void validateMapsOtherClientErrorsToRejected() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andRespond(
            withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_token\"}"));

    assertThatThrownBy(() -> fixture.client.validate("at-1", null))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.REJECTED);
  }

  @Test
  void refreshMapsInvalidGrantToRejected() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/token"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_grant\"}"));

    assertThatThrownBy(() -> fixture.client.refresh("rt-old"))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.REJECTED);
  }

  @Test
  void mapsNonJsonErrorBodyToRejected() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/token"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN).body("denied"));

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1"))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.REJECTED);
  }

  @Test
  void maps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://auth.test/oauth/token")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1"))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsIncompleteTokenSetToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/token"))
        .andRespond(
            withSuccess("{\"access_token\":\"at-1\",\"subject\":\"s\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1"))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void mapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andRespond(withSuccess("not-json", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.validate("at-1", null))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void mapsSocketTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.validate("at-1", null))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void mapsJdkHttpTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/validate"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "request timed out", new HttpTimeoutException("request timed out"));
            });

    assertThatThrownBy(() -> fixture.client.validate("at-1", null))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void mapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/revoke"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.client.revoke("rt-1"))
        .isInstanceOf(AuthServerIntegrationException.class)
        .extracting(ex -> ((AuthServerIntegrationException) ex).reason())
        .isEqualTo(AuthServerIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void revokeSendsTokenWithClientCredentials() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://auth.test/oauth/revoke"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.token").value("rt-1"))
        .andExpect(jsonPath("$.client_id").value("academic-api"))
        .andExpect(jsonPath("$.client_secret").value("academic-secret"))
        .andRespond(withSuccess());

    fixture.client.revoke("rt-1");

    fixture.server.verify();
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl(BridgeTestProperties.AUTH_SERVER).build();
    return new ClientFixture(
        new AuthServerClient(restClient, BridgeTestProperties.academic(), new ObjectMapper()),
        server);
  }

  private record ClientFixture(AuthServerClient client, MockRestServiceServer server) {}
}
