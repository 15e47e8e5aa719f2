package com.campussso.authserver.repository;

import com.campussso.authserver.model.SsoSession;
import java.time.Instant;
import java.util.Optional;

/**
 * IdP セッションの保存先。
 *
 * <p>subject ごとに有効なセッションは高々 1 つ。{@link #replaceForSubject} は既存セッションの破棄と
 * 新規保存を不可分に行うこと。
 */
public interface SsoSessionRepository {

  void replaceForSubject(SsoSession session);

  Optional<SsoSession> findById(String sessionId);

  void deleteById(String sessionId);

  int deleteExpired(Instant now);
}
