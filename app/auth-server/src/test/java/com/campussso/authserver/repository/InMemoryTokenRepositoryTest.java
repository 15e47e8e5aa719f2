package com.campussso.authserver.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.campussso.authserver.model.AccessTokenRecord;
import com.campussso.authserver.model.FamilyState;
import com.campussso.authserver.model.RefreshState;
import com.campussso.authserver.model.RefreshTokenRecord;
import com.campussso.authserver.model.TokenFamily;
import com.campussso.authserver.model.UserRole;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryTokenRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private final InMemoryTokenRepository repository = new InMemoryTokenRepository();

  @Test
  void compareAndSetRotatesOnlyFromExpectedState() {
    final RefreshTokenRecord active =
        new RefreshTokenRecord("rt-1", "family-1", NOW, NOW.plusSeconds(3600), RefreshState.ACTIVE);
    repository.saveRefreshToken(active);

    assertThat(repository.compareAndSetRefreshToken(active, active.rotate())).isTrue();
    assertThat(repository.compareAndSetRefreshToken(active, active.rotate())).isFalse();
    assertThat(repository.findRefreshToken("rt-1").orElseThrow().state())
        .isEqualTo(RefreshState.ROTATED);
  }

  @Test
  void revokeFamilyReportsOnlyFirstTransition() {
    repository.saveFamily(family("family-1"));

    assertThat(repository.revokeFamily("family-1")).isTrue();
    assertThat(repository.revokeFamily("family-1")).isFalse();
    assertThat(repository.revokeFamily("missing")).isFalse();
    assertThat(repository.findFamily("family-1").orElseThrow().state())
        .isEqualTo(FamilyState.REVOKED);
  }

  @Test
  void deleteExpiredDropsTokensAndOrphanedFamilies() {
    repository.saveFamily(family("family-1"));
    repository.saveFamily(family("family-2"));
    repository.saveAccessToken(new AccessTokenRecord("at-1", "family-1", NOW, NOW));
    repository.saveRefreshToken(
        new RefreshTokenRecord("rt-1", "family-1", NOW, NOW, RefreshState.ACTIVE));
    repository.saveRefreshToken(
        new RefreshTokenRecord(
            "rt-2", "family-2", NOW, NOW.plusSeconds(3600), RefreshState.ACTIVE));

    assertThat(repository.deleteExpired(NOW)).isEqualTo(3);
    assertThat(repository.findFamily("family-1")).isEmpty();
    assertThat(repository.findFamily("family-2")).isPresent();
    assertThat(repository.findRefreshToken("rt-2")).isPresent();
  }

  private TokenFamily family(String familyId) {
    return new TokenFamily(
        familyId,
        "student01",
        "academic-api",
        "courses.read",
        UserRole.STUDENT,
        null,
        NOW,
        FamilyState.ACTIVE);
  }
}
