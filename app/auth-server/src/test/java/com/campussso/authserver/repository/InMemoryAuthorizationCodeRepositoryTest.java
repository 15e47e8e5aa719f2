package com.campussso.authserver.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.campussso.authserver.model.AuthorizationCode;
import com.campussso.authserver.model.CodeState;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryAuthorizationCodeRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private final InMemoryAuthorizationCodeRepository repository =
      new InMemoryAuthorizationCodeRepository();

  @Test
  void consumeTransitionsPendingCodeOnlyOnce() {
    repository.save(code("code-1", NOW.plusSeconds(300)));

    final AuthorizationCode consumed = repository.consume("code-1").orElseThrow();

    assertThat(consumed.state()).isEqualTo(CodeState.PENDING);
    assertThat(repository.consume("code-1")).isEmpty();
    assertThat(repository.consume("missing")).isEmpty();
    assertThat(repository.consume(null)).isEmpty();
  }

  @Test
  void deleteExpiredKeepsLiveCodes() {
    repository.save(code("expired", NOW.minus(Duration.ofSeconds(1))));
    repository.save(code("live", NOW.plusSeconds(60)));

    assertThat(repository.deleteExpired(NOW)).isEqualTo(1);
    assertThat(repository.consume("expired")).isEmpty();
    assertThat(repository.consume("live")).isPresent();
  }

  private AuthorizationCode code(String value, Instant expiresAt) {
    return new AuthorizationCode(
        value,
        "academic-api",
        "https://academic.localhost:5001/session/callback",
        "student01",
        "courses.read",
        null,
        NOW,
        expiresAt,
        CodeState.PENDING);
  }
}
