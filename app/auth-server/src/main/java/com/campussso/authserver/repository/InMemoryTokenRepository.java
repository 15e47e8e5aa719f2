package com.campussso.authserver.repository;

import com.campussso.authserver.model.AccessTokenRecord;
import com.campussso.authserver.model.RefreshTokenRecord;
import com.campussso.authserver.model.TokenFamily;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTokenRepository implements TokenRepository {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenRepository.class);

  private final ConcurrentHashMap<String, TokenFamily> families = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, AccessTokenRecord> accessTokens =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, RefreshTokenRecord> refreshTokens =
      new ConcurrentHashMap<>();

  @Override
  public void saveFamily(TokenFamily family) {
    families.put(family.familyId(), family);
  }

  @Override
  public Optional<TokenFamily> findFamily(String familyId) {
    if (familyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(families.get(familyId));
  }

  @Override
  public boolean revokeFamily(String familyId) {
    final AtomicBoolean revoked = new AtomicBoolean(false);
    families.computeIfPresent(
        familyId,
        (key, current) -> {
          if (!current.isActive()) {
            return current;
          }
          revoked.set(true);
          return current.revoke();
        });
    return revoked.get();
  }

  @Override
  public void saveAccessToken(AccessTokenRecord accessToken) {
    accessTokens.put(accessToken.token(), accessToken);
  }

  @Override
  public Optional<AccessTokenRecord> findAccessToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(accessTokens.get(token));
  }

  @Override
  public void saveRefreshToken(RefreshTokenRecord refreshToken) {
    refreshTokens.put(refreshToken.token(), refreshToken);
  }

  @Override
  public Optional<RefreshTokenRecord> findRefreshToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(refreshTokens.get(token));
  }

  @Override
  public boolean compareAndSetRefreshToken(
      RefreshTokenRecord expected, RefreshTokenRecord updated) {
    return refreshTokens.replace(expected.token(), expected, updated);
  }

  @Override
  public int deleteExpired(Instant now) {
    int deleted = 0;
    for (AccessTokenRecord accessToken : accessTokens.values()) {
      if (accessToken.isExpiredAt(now) && accessTokens.remove(accessToken.token(), accessToken)) {
        deleted++;
      }
    }
    // ROTATED の refresh token も期限までは replay 検知のために残す。
    for (RefreshTokenRecord refreshToken : refreshTokens.values()) {
      if (refreshToken.isExpiredAt(now)
          && refreshTokens.remove(refreshToken.token(), refreshToken)) {
        deleted++;
      }
    }
    final Set<String> liveFamilies = new HashSet<>();
    refreshTokens.values().forEach(token -> liveFamilies.add(token.familyId()));
    accessTokens.values().forEach(token -> liveFamilies.add(token.familyId()));
    for (String familyId : families.keySet()) {
      if (!liveFamilies.contains(familyId) && families.remove(familyId) != null) {
        deleted++;
      }
    }
    logger.debug("token repository purge removed {} entries", deleted);
    return deleted;
  }
}
