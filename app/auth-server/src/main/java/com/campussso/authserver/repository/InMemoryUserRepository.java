package com.campussso.authserver.repository;

import com.campussso.authserver.model.UserRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** プロセス内メモリの {@link UserRepository}。再起動で seed 以外の登録は失われる。 */
@Repository
public class InMemoryUserRepository implements UserRepository {

  // subject id はユーザー名と同一なので 1 つの索引で足りる。
  private final ConcurrentHashMap<String, UserRecord> users = new ConcurrentHashMap<>();

  @Override
  public Optional<UserRecord> findByUsername(String username) {
    if (username == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(users.get(username));
  }

  @Override
  public Optional<UserRecord> findBySubjectId(String subjectId) {
    return findByUsername(subjectId);
  }

  @Override
  public boolean insertIfAbsent(UserRecord user) {
    return users.putIfAbsent(user.username(), user) == null;
  }

  @Override
  public boolean replace(UserRecord expected, UserRecord updated) {
    return users.replace(expected.username(), expected, updated);
  }

  @Override
  public List<UserRecord> findAll() {
    return users.values().stream().sorted(Comparator.comparing(UserRecord::username)).toList();
  }
}
