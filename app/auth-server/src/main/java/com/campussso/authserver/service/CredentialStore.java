/*
 * どこで: auth-server サービス層
 * 何を: 利用者の登録・パスワード照合・資格情報のローテーションを行う
 * なぜ: パスワードハッシュと fingerprint 束縛の扱いを Session Manager から切り離すため
 */
package com.campussso.authserver.service;

import com.campussso.authserver.model.UserRecord;
import com.campussso.authserver.model.UserRole;
import com.campussso.authserver.repository.UserRepository;
import com.campussso.common.security.CertificateFingerprintResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CredentialStore {

  private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);
  private static final Pattern USERNAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]{3,64}");
  private static final int MIN_PASSWORD_LENGTH = 8;
  // 未登録ユーザーでも照合コストを揃えるためのダミーハッシュ。
  private static final String UNKNOWN_USER_PASSWORD = "unknown-user-password";

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final Clock clock;
  private volatile String unknownUserHash;

  /**
   * 役割:
   * - 利用者を新規登録する。
   *
   * 期待動作:
   * - 同名の利用者が存在する場合は USER_EXISTS とする。
   * - allowAdmin が false のとき admin ロールでの登録は拒否する。
   * - fingerprint は正規化して保存する。
   */
  public UserRecord register(
      String username, String password, String role, String fingerprint, boolean allowAdmin) {
    if (username == null || !USERNAME_PATTERN.matcher(username).matches()) {
      throw new SsoException(SsoException.Reason.INVALID_REQUEST, "username is invalid");
    }
    validatePassword(password);
    final UserRole userRole = parseRole(role);
    if (userRole == UserRole.ADMIN && !allowAdmin) {
      throw new SsoException(
          SsoException.Reason.FORBIDDEN, "admin accounts cannot be self-registered");
    }
    final Instant now = Instant.now(clock);
    final UserRecord user =
        new UserRecord(
            username,
            username,
            passwordEncoder.encode(password),
            userRole,
            CertificateFingerprintResolver.normalize(fingerprint),
            now,
            now);
    if (!userRepository.insertIfAbsent(user)) {
      throw new SsoException(SsoException.Reason.USER_EXISTS, "user already exists");
    }
    logger.info(
        "user registered subject={} role={} certificateBound={}",
        user.subjectId(),
        userRole.wireValue(),
        user.hasBoundCertificate());
    return user;
  }

  /** ユーザー名とパスワードを照合する。失敗理由は区別せず INVALID_CREDENTIALS とする。 */
  public UserRecord verify(String username, String password) {
    if (username == null || username.isBlank() || password == null || password.isEmpty()) {
      throw new SsoException(SsoException.Reason.INVALID_CREDENTIALS, "invalid credentials");
    }
    final Optional<UserRecord> user = userRepository.findByUsername(username);
    if (user.isEmpty()) {
      passwordEncoder.matches(password, unknownUserHash());
      throw new SsoException(SsoException.Reason.INVALID_CREDENTIALS, "invalid credentials");
    }
    if (!passwordEncoder.matches(password, user.get().passwordHash())) {
      throw new SsoException(SsoException.Reason.INVALID_CREDENTIALS, "invalid credentials");
    }
    return user.get();
  }

  public Optional<UserRecord> findBySubject(String subjectId) {
    return userRepository.findBySubjectId(subjectId);
  }

  public UserRecord updatePassword(String subjectId, String currentPassword, String newPassword) {
    validatePassword(newPassword);
    final String newHash = passwordEncoder.encode(newPassword);
    final UserRecord updated =
        updateUser(
            subjectId,
            user -> {
              if (currentPassword == null
                  || !passwordEncoder.matches(currentPassword, user.passwordHash())) {
                throw new SsoException(
                    SsoException.Reason.INVALID_CREDENTIALS, "invalid credentials");
              }
              return user.withPasswordHash(newHash, Instant.now(clock));
            });
    logger.info("password rotated subject={}", subjectId);
    return updated;
  }

  public UserRecord bindFingerprint(String subjectId, String fingerprint) {
    final String normalized = CertificateFingerprintResolver.normalize(fingerprint);
    if (normalized == null) {
      throw new SsoException(
          SsoException.Reason.INVALID_REQUEST, "client certificate fingerprint is required");
    }
    final UserRecord updated =
        updateUser(
            subjectId, user -> user.withCertificateFingerprint(normalized, Instant.now(clock)));
    logger.info("certificate bound subject={}", subjectId);
    return updated;
  }

  public List<UserRecord> listBoundCertificates() {
    return userRepository.findAll().stream().filter(UserRecord::hasBoundCertificate).toList();
  }

  /**
   * 最新のレコードに change を適用し、compare-and-set で書き戻す。
   *
   * <p>読み取り後に別の更新が入っていた場合は読み直して適用し直すので、並行する更新はどちらも失われない。
   */
  private UserRecord updateUser(String subjectId, UnaryOperator<UserRecord> change) {
    while (true) {
      final UserRecord current = requireUser(subjectId);
      final UserRecord updated = change.apply(current);
      if (userRepository.replace(current, updated)) {
        return updated;
      }
      logger.debug("concurrent user update detected subject={}; retrying", subjectId);
    }
  }

  private UserRecord requireUser(String subjectId) {
    return userRepository
        .findBySubjectId(subjectId)
        .orElseThrow(() -> new SsoException(SsoException.Reason.NO_SESSION, "user is unknown"));
  }

  private UserRole parseRole(String role) {
    if (role == null || role.isBlank()) {
      return UserRole.STUDENT;
    }
    try {
      return UserRole.fromWireValue(role);
    } catch (IllegalArgumentException ex) {
      throw new SsoException(SsoException.Reason.INVALID_REQUEST, ex.getMessage(), ex);
    }
  }

  private void validatePassword(String password) {
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      throw new SsoException(
          SsoException.Reason.INVALID_REQUEST,
          "password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
  }

  private String unknownUserHash() {
    String hash = unknownUserHash;
    if (hash == null) {
      hash = passwordEncoder.encode(UNKNOWN_USER_PASSWORD);
      unknownUserHash = hash;
    }
    return hash;
  }
}
