package com.campussso.bridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.campussso.bridge.model.HeldTokens;
import com.campussso.bridge.model.LocalSession;
import com.campussso.bridge.model.LoginState;
import com.campussso.bridge.repository.InMemoryLocalSessionRepository;
import com.campussso.bridge.repository.InMemoryLoginStateRepository;
import com.campussso.bridge.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LocalSessionRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");

  @Test
  void cleanupPurgesExpiredSessionsAndStates() {
    final MutableClock clock = new MutableClock(NOW);
    final InMemoryLocalSessionRepository sessions = new InMemoryLocalSessionRepository();
    final InMemoryLoginStateRepository states = new InMemoryLoginStateRepository();
    sessions.save(
        new LocalSession(
            "sid-1",
            "cloud-api",
            new HeldTokens("at", "rt", "teacher01", "files.read", NOW, NOW.plusSeconds(60)),
            NOW));
    states.save(new LoginState("s-1", "b-1", "/", NOW.plusSeconds(30)));
    final LocalSessionRetentionService service =
        new LocalSessionRetentionService(sessions, states, clock);

    assertThat(service.cleanup()).isZero();

    clock.advance(Duration.ofMinutes(2));
    assertThat(service.cleanup()).isEqualTo(2);
    assertThat(sessions.findById("sid-1")).isEmpty();
  }
}
