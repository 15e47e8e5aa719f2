package com.campussso.bridge.repository;

import com.campussso.bridge.model.LoginState;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryLoginStateRepository implements LoginStateRepository {

  private final ConcurrentMap<String, LoginState> states = new ConcurrentHashMap<>();

  @Override
  public void save(LoginState state) {
    states.put(state.state(), state);
  }

  @Override
  public Optional<LoginState> consume(String state) {
    if (state == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(states.remove(state));
  }

  @Override
  public int deleteExpired(Instant now) {
    int removed = 0;
    for (LoginState state : states.values()) {
      if (state.isExpiredAt(now) && states.remove(state.state(), state)) {
        removed++;
      }
    }
    return removed;
  }
}
