package com.campussso.bridge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.campussso.bridge.model.HeldTokens;
import com.campussso.bridge.model.LocalSession;
import com.campussso.bridge.model.SsoPrincipal;
import com.campussso.bridge.repository.InMemoryLocalSessionRepository;
import com.campussso.bridge.service.dto.TokenSetResponse;
import com.campussso.bridge.service.dto.ValidateTokenResponse;
import com.campussso.bridge.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ValidationClientTest {

  private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");
  private static final ValidateTokenResponse STUDENT =
      new ValidateTokenResponse("student01", "student", "courses.read", "academic-api", 200);

  @Mock private AuthServerClient authServerClient;

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemoryLocalSessionRepository sessions = new InMemoryLocalSessionRepository();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private ValidationClient client;

  @BeforeEach
  void setUp() {
    client = new ValidationClient(authServerClient, sessions, new BridgeMetrics(meterRegistry), clock);
  }

  @Test
  void validAccessTokenYieldsPrincipal() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", "fp")).thenReturn(STUDENT);

    final SsoPrincipal principal = client.authenticate("sid-1", "fp");

    assertThat(principal.subject()).isEqualTo("student01");
    assertThat(principal.role()).isEqualTo("student");
    assertThat(principal.hasScope("courses.read")).isTrue();
    assertThat(meterRegistry.counter("bridge.validation.total", "result", "success").count())
        .isEqualTo(1.0);
  }

  @Test
  void missingCookieOrMappingIsUnauthenticated() {
    assertThatThrownBy(() -> client.authenticate(null, null))
        .isInstanceOf(UnauthenticatedException.class);
    assertThatThrownBy(() -> client.authenticate("unknown", null))
        .isInstanceOf(UnauthenticatedException.class);
    verify(authServerClient, never()).validate(anyString(), any());
  }

  @Test
  void sessionPastRefreshExpiryIsDroppedWithoutCallingAuthServer() {
    saveSession("sid-1", "at-1", "rt-1");
    clock.advance(Duration.ofHours(2));

    assertThatThrownBy(() -> client.authenticate("sid-1", null))
        .isInstanceOf(UnauthenticatedException.class);
    assertThat(sessions.findById("sid-1")).isEmpty();
    verify(authServerClient, never()).validate(anyString(), any());
  }

  @Test
  void expiredAccessTokenIsRefreshedOnceAndRetried() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null)).thenThrow(expired());
    when(authServerClient.refresh("rt-1"))
        .thenReturn(new TokenSetResponse("at-2", "rt-2", "Bearer", 300, 3600, "student01", "s"));
    when(authServerClient.validate("at-2", null)).thenReturn(STUDENT);

    final SsoPrincipal principal = client.authenticate("sid-1", null);

    assertThat(principal.subject()).isEqualTo("student01");
    final HeldTokens stored = sessions.findById("sid-1").orElseThrow().tokens();
    assertThat(stored.accessToken()).isEqualTo("at-2");
    assertThat(stored.refreshToken()).isEqualTo("rt-2");
    assertThat(meterRegistry.counter("bridge.validation.total", "result", "refreshed").count())
        .isEqualTo(1.0);
  }

  @Test
  void failedRefreshDeletesMapping() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null)).thenThrow(expired());
    when(authServerClient.refresh("rt-1"))
        .thenThrow(
            new AuthServerIntegrationException(
                AuthServerIntegrationException.Reason.REJECTED, "invalid_grant"));

    assertThatThrownBy(() -> client.authenticate("sid-1", null))
        .isInstanceOf(UnauthenticatedException.class)
        .matches(ex -> ((UnauthenticatedException) ex).sessionEnded());
    assertThat(sessions.findById("sid-1")).isEmpty();
  }

  @Test
  void secondExpiryAfterRefreshIsNotRetriedAgain() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null)).thenThrow(expired());
    when(authServerClient.refresh("rt-1"))
        .thenReturn(new TokenSetResponse("at-2", "rt-2", "Bearer", 300, 3600, "student01", "s"));
    when(authServerClient.validate("at-2", null)).thenThrow(expired());

    assertThatThrownBy(() -> client.authenticate("sid-1", null))
        .isInstanceOf(UnauthenticatedException.class);
    verify(authServerClient, times(1)).refresh(anyString());
    assertThat(sessions.findById("sid-1")).isEmpty();
  }

  @Test
  void rejectedTokenDeletesMapping() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", "other"))
        .thenThrow(
            new AuthServerIntegrationException(
                AuthServerIntegrationException.Reason.REJECTED, "certificate_mismatch"));

    assertThatThrownBy(() -> client.authenticate("sid-1", "other"))
        .isInstanceOf(UnauthenticatedException.class);
    assertThat(sessions.findById("sid-1")).isEmpty();
    verify(authServerClient, never()).refresh(anyString());
  }

  @Test
  void unreachableAuthServerFailsClosedButKeepsMapping() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null))
        .thenThrow(
            new AuthServerIntegrationException(
                AuthServerIntegrationException.Reason.TIMEOUT, "timeout"));

    assertThatThrownBy(() -> client.authenticate("sid-1", null))
        .isInstanceOf(UnauthenticatedException.class)
        .matches(ex -> !((UnauthenticatedException) ex).sessionEnded());
    assertThat(sessions.findById("sid-1")).isPresent();
    assertThat(meterRegistry.counter("bridge.validation.total", "result", "unavailable").count())
        .isEqualTo(1.0);
  }

  @Test
  void subjectDifferentFromHeldPairIsRejected() {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null))
        .thenReturn(new ValidateTokenResponse("teacher01", "teacher", "", "academic-api", 100));

    assertThatThrownBy(() -> client.authenticate("sid-1", null))
        .isInstanceOf(UnauthenticatedException.class);
    assertThat(sessions.findById("sid-1")).isEmpty();
  }

  @Test
  void concurrentExpiredRequestsRefreshOnlyOnce() throws Exception {
    saveSession("sid-1", "at-1", "rt-1");
    when(authServerClient.validate("at-1", null)).thenThrow(expired());
    when(authServerClient.refresh("rt-1"))
        .thenReturn(new TokenSetResponse("at-2", "rt-2", "Bearer", 300, 3600, "student01", "s"));
    when(authServerClient.validate("at-2", null)).thenReturn(STUDENT);

    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<SsoPrincipal>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return client.authenticate("sid-1", null);
                }));
      }
      start.countDown();
      for (Future<SsoPrincipal> result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS).subject()).isEqualTo("student01");
      }
    } finally {
      executor.shutdownNow();
    }

    verify(authServerClient, times(1)).refresh("rt-1");
  }

  private void saveSession(String sessionId, String accessToken, String refreshToken) {
    sessions.save(
        new LocalSession(
            sessionId,
            "academic-api",
            new HeldTokens(
                accessToken,
                refreshToken,
                "student01",
                "courses.read",
                NOW.plusSeconds(300),
                NOW.plusSeconds(3600)),
            NOW));
  }

  private static AuthServerIntegrationException expired() {
    return new AuthServerIntegrationException(
        AuthServerIntegrationException.Reason.TOKEN_EXPIRED, "expired");
  }
}
