package com.campussso.bridge.repository;

import com.campussso.bridge.model.LoginState;
import java.time.Instant;
import java.util.Optional;

public interface LoginStateRepository {

  void save(LoginState state);

  /** state を取り除いて返す。二度目以降は empty。 */
  Optional<LoginState> consume(String state);

  int deleteExpired(Instant now);
}
