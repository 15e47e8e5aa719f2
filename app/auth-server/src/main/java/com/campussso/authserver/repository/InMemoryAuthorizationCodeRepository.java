package com.campussso.authserver.repository;

import com.campussso.authserver.model.AuthorizationCode;
import com.campussso.authserver.model.CodeState;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

  private final ConcurrentHashMap<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

  @Override
  public void save(AuthorizationCode code) {
    codes.put(code.code(), code);
  }

  @Override
  public Optional<AuthorizationCode> consume(String code) {
    if (code == null) {
      return Optional.empty();
    }
    final AtomicReference<AuthorizationCode> consumed = new AtomicReference<>();
    // computeIfPresent はキー単位で直列化されるため、同時 redeem の勝者は 1 つだけになる。
    codes.computeIfPresent(
        code,
        (key, current) -> {
          if (current.state() != CodeState.PENDING) {
            return current;
          }
          consumed.set(current);
          return current.consume();
        });
    return Optional.ofNullable(consumed.get());
  }

  @Override
  public int deleteExpired(Instant now) {
    int deleted = 0;
    for (AuthorizationCode code : codes.values()) {
      if (code.isExpiredAt(now) && codes.remove(code.code(), code)) {
        deleted++;
      }
    }
    return deleted;
  }
}
