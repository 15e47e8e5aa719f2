package com.campussso.authserver.repository;

import com.campussso.authserver.model.SsoSession;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySsoSessionRepository implements SsoSessionRepository {

  private final Map<String, SsoSession> sessions = new ConcurrentHashMap<>();
  // subjectId -> sessionId の逆引き。sessions と同期して更新する。
  private final ConcurrentHashMap<String, String> subjectIndex = new ConcurrentHashMap<>();

  @Override
  public void replaceForSubject(SsoSession session) {
    subjectIndex.compute(
        session.subjectId(),
        (subjectId, previousSessionId) -> {
          if (previousSessionId != null) {
            sessions.remove(previousSessionId);
          }
          sessions.put(session.sessionId(), session);
          return session.sessionId();
        });
  }

  @Override
  public Optional<SsoSession> findById(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public void deleteById(String sessionId) {
    if (sessionId == null) {
      return;
    }
    final SsoSession removed = sessions.remove(sessionId);
    if (removed != null) {
      subjectIndex.remove(removed.subjectId(), sessionId);
    }
  }

  @Override
  public int deleteExpired(Instant now) {
    int deleted = 0;
    for (SsoSession session : sessions.values()) {
      if (session.isExpiredAt(now) && sessions.remove(session.sessionId(), session)) {
        subjectIndex.remove(session.subjectId(), session.sessionId());
        deleted++;
      }
    }
    return deleted;
  }
}
