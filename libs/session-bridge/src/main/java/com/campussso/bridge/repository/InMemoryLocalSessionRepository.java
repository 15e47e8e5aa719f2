package com.campussso.bridge.repository;

import com.campussso.bridge.model.LocalSession;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryLocalSessionRepository implements LocalSessionRepository {

  private final ConcurrentMap<String, LocalSession> sessions = new ConcurrentHashMap<>();

  @Override
  public void save(LocalSession session) {
    sessions.put(session.sessionId(), session);
  }

  @Override
  public Optional<LocalSession> findById(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public boolean replace(LocalSession expected, LocalSession updated) {
    return sessions.replace(expected.sessionId(), expected, updated);
  }

  @Override
  public Optional<LocalSession> deleteById(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.remove(sessionId));
  }

  @Override
  public int deleteExpired(Instant now) {
    int removed = 0;
    for (LocalSession session : sessions.values()) {
      if (session.isExpiredAt(now) && sessions.remove(session.sessionId(), session)) {
        removed++;
      }
    }
    return removed;
  }
}
