package com.campussso.authserver.repository;

import com.campussso.authserver.model.AuthorizationCode;
import java.time.Instant;
import java.util.Optional;

public interface AuthorizationCodeRepository {

  void save(AuthorizationCode code);

  /**
   * PENDING のコードを CONSUMED へ不可分に遷移させる。
   *
   * @return 遷移に成功した場合は遷移前のレコード。未知または消費済みなら empty。
   */
  Optional<AuthorizationCode> consume(String code);

  int deleteExpired(Instant now);
}
