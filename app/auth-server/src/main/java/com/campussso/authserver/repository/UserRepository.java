package com.campussso.authserver.repository;

import com.campussso.authserver.model.UserRecord;
import java.util.List;
import java.util.Optional;

/**
 * 利用者レコードの保存先。
 *
 * <p>実装はスレッドセーフであること。
 */
public interface UserRepository {

  Optional<UserRecord> findByUsername(String username);

  Optional<UserRecord> findBySubjectId(String subjectId);

  /**
   * 同名の利用者が存在しない場合のみ保存する。
   *
   * @return 保存した場合 true
   */
  boolean insertIfAbsent(UserRecord user);

  /**
   * 保存済みの値が expected のままである場合のみ updated に置き換える。
   *
   * @return 置き換えた場合 true。別の更新が先に入っていた場合 false
   */
  boolean replace(UserRecord expected, UserRecord updated);

  List<UserRecord> findAll();
}
