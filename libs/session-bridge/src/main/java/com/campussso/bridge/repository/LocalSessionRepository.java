package com.campussso.bridge.repository;

import com.campussso.bridge.model.LocalSession;
import java.time.Instant;
import java.util.Optional;

public interface LocalSessionRepository {

  void save(LocalSession session);

  Optional<LocalSession> findById(String sessionId);

  /** 保持中の値が expected と同一の場合のみ置き換える。 */
  boolean replace(LocalSession expected, LocalSession updated);

  Optional<LocalSession> deleteById(String sessionId);

  int deleteExpired(Instant now);
}
