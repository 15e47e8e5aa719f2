/*
 * どこで: session bridge 結合テスト
 * 何を: login → callback → 保護 API → logout を SecurityFilterChain 込みで通す
 * なぜ: cookie 属性・リダイレクト先・401 応答という front-channel の契約を保証するため
 */
package com.campussso.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.cookie;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.campussso.bridge.service.AuthServerClient;
import com.campussso.bridge.service.dto.TokenSetResponse;
import com.campussso.bridge.service.dto.ValidateTokenResponse;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.util.UriComponentsBuilder;

@SpringBootTest(
    properties = {
      "sso.bridge.client-id=academic-api",
      "sso.bridge.client-secret=academic-secret",
      "sso.bridge.redirect-uri=https://academic.localhost:5001/session/callback",
      "sso.bridge.scope=courses.read grades.read",
      "sso.bridge.authorize-endpoint=https://sso.localhost:5000/oauth/authorize",
      "sso.bridge.cookie-name=ACADEMIC_SESSION"
    })
@AutoConfigureMockMvc
class SessionBridgeFlowIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AuthServerClient authServerClient;

  @Test
  void loginCallbackAndProtectedCallShareTheSiteCookie() throws Exception {
    final MvcResult login = startLogin("/session/me");
    final Cookie loginCookie = login.getResponse().getCookie("ACADEMIC_SESSION_LOGIN");
    assertThat(loginCookie).isNotNull();
    assertThat(login.getResponse().getHeader(HttpHeaders.SET_COOKIE))
        .contains("HttpOnly")
        .contains("SameSite=Lax")
        .contains("Path=/session/callback");
    when(authServerClient.exchangeCode("code-1"))
        .thenReturn(
            new TokenSetResponse(
                "at-1", "rt-1", "Bearer", 300, 3600, "student01", "courses.read grades.read"));

    final MvcResult callback =
        mockMvc
            .perform(
                get("/session/callback")
                    .param("code", "code-1")
                    .param("state", stateOf(login))
                    .cookie(loginCookie))
            .andExpect(status().isFound())
            .andExpect(header().string(HttpHeaders.LOCATION, "/session/me"))
            .andReturn();
    final String setCookie = callback.getResponse().getHeader(HttpHeaders.SET_COOKIE);
    assertThat(setCookie)
        .startsWith("ACADEMIC_SESSION=")
        .contains("HttpOnly")
        .contains("Secure")
        .contains("SameSite=Lax")
        .doesNotContain("at-1")
        .doesNotContain("rt-1");
    final Cookie siteCookie = callback.getResponse().getCookie("ACADEMIC_SESSION");
    assertThat(siteCookie).isNotNull();

    when(authServerClient.validate(any(), isNull()))
        .thenReturn(
            new ValidateTokenResponse(
                "student01", "student", "courses.read grades.read", "academic-api", 300));
    mockMvc
        .perform(get("/session/me").cookie(siteCookie))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject").value("student01"))
        .andExpect(jsonPath("$.role").value("student"))
        .andExpect(jsonPath("$.scopes[0]").value("courses.read"));

    mockMvc
        .perform(post("/session/logout").cookie(siteCookie))
        .andExpect(status().isNoContent())
        .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
    verify(authServerClient).revoke("rt-1");

    mockMvc.perform(get("/session/me").cookie(siteCookie)).andExpect(status().isUnauthorized());
  }

  @Test
  void unknownStateRedirectsToFailurePageWithoutCookie() throws Exception {
    mockMvc
        .perform(get("/session/callback").param("code", "code-1").param("state", "forged"))
        .andExpect(status().isFound())
        .andExpect(header().string(HttpHeaders.LOCATION, "/?login_error=1"))
        .andExpect(cookie().doesNotExist("ACADEMIC_SESSION"));
  }

  @Test
  void callbackOpenedInAnotherBrowserDoesNotSignItIn() throws Exception {
    final MvcResult attackerLogin = startLogin("/");

    mockMvc
        .perform(
            get("/session/callback")
                .param("code", "attacker-code")
                .param("state", stateOf(attackerLogin)))
        .andExpect(status().isFound())
        .andExpect(header().string(HttpHeaders.LOCATION, "/?login_error=1"))
        .andExpect(cookie().doesNotExist("ACADEMIC_SESSION"))
        .andExpect(cookie().maxAge("ACADEMIC_SESSION_LOGIN", 0));
    verify(authServerClient, never()).exchangeCode(any());
  }

  @Test
  void protectedApiWithoutCookieIsUnauthorized() throws Exception {
    mockMvc
        .perform(get("/session/me"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("unauthenticated"));
  }

  @Test
  void protectedPageWithoutCookieRedirectsToLogin() throws Exception {
    mockMvc
        .perform(get("/session/me").header(HttpHeaders.ACCEPT, "text/html"))
        .andExpect(status().isFound())
        .andExpect(
            header()
                .string(
                    HttpHeaders.LOCATION,
                    startsWith("/session/login?return_to=")));
  }

  private MvcResult startLogin(String returnTo) throws Exception {
    final MvcResult result =
        mockMvc
            .perform(get("/session/login").param("return_to", returnTo))
            .andExpect(status().isFound())
            .andReturn();
    final String location = result.getResponse().getHeader(HttpHeaders.LOCATION);
    assertThat(location).startsWith("https://sso.localhost:5000/oauth/authorize?");
    return result;
  }

  private static String stateOf(MvcResult login) {
    return UriComponentsBuilder.fromUriString(login.getResponse().getHeader(HttpHeaders.LOCATION))
        .build()
        .getQueryParams()
        .getFirst("state");
  }
}
