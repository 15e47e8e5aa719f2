package com.campussso.authserver.repository;

import com.campussso.authserver.model.AccessTokenRecord;
import com.campussso.authserver.model.RefreshTokenRecord;
import com.campussso.authserver.model.TokenFamily;
import java.time.Instant;
import java.util.Optional;

/**
 * token family と、それに属する access/refresh token の保存先。
 *
 * <p>token の有効性は所属 family の状態にも従う。family を REVOKED にした時点で、配下の token は
 * すべて無効として扱われる。
 */
public interface TokenRepository {

  void saveFamily(TokenFamily family);

  Optional<TokenFamily> findFamily(String familyId);

  /**
   * family を REVOKED にする。
   *
   * @return ACTIVE から遷移した場合 true
   */
  boolean revokeFamily(String familyId);

  void saveAccessToken(AccessTokenRecord accessToken);

  Optional<AccessTokenRecord> findAccessToken(String token);

  void saveRefreshToken(RefreshTokenRecord refreshToken);

  Optional<RefreshTokenRecord> findRefreshToken(String token);

  /**
   * refresh token を expected から updated へ比較交換する。
   *
   * @return 現在値が expected と一致して置き換えた場合 true
   */
  boolean compareAndSetRefreshToken(RefreshTokenRecord expected, RefreshTokenRecord updated);

  int deleteExpired(Instant now);
}
