/*
 * どこで: auth-server API
 * 何を: 利用者登録・ログイン/ログアウト・自分情報・資格情報ローテーションの API
 * なぜ: IdP の SSO cookie を発行・破棄する入口を 1 つにまとめるため
 */
package com.campussso.authserver.api;

import com.campussso.authserver.api.request.LoginRequest;
import com.campussso.authserver.api.request.PasswordChangeRequest;
import com.campussso.authserver.api.request.RegisterRequest;
import com.campussso.authserver.api.response.UserResponse;
import com.campussso.authserver.model.SsoSession;
import com.campussso.authserver.model.UserRecord;
import com.campussso.authserver.service.CredentialStore;
import com.campussso.authserver.service.SessionManager;
import com.campussso.authserver.service.SsoCookieFactory;
import com.campussso.authserver.service.SsoException;
import com.campussso.common.security.CertificateFingerprintResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

  static final String SESSION_COOKIE = "${sso.session.cookie-name:SSO_SESSION}";

  private final CredentialStore credentialStore;
  private final SessionManager sessionManager;
  private final SsoCookieFactory cookieFactory;
  private final CertificateFingerprintResolver fingerprintResolver;

  /**
   * 役割:
   * - 新しい利用者を登録する。
   *
   * 期待動作:
   * - fingerprint は本文の値を優先し、無ければ提示されたクライアント証明書から求める。
   * - admin としての自己登録は 403、重複は 409 とする。
   */
  @PostMapping("/register")
  public ResponseEntity<UserResponse> register(
      @Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
    final String fingerprint =
        request.certFingerprint() != null
            ? request.certFingerprint()
            : fingerprintResolver.resolve(httpRequest).orElse(null);
    final UserRecord user =
        credentialStore.register(
            request.username(), request.password(), request.role(), fingerprint, false);
    return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
  }

  /**
   * 役割:
   * - パスワードと提示証明書で認証し、SSO cookie を発行する。
   *
   * 期待動作:
   * - 同じ利用者の既存 SSO セッションは無効になる。
   */
  @PostMapping("/login")
  public ResponseEntity<UserResponse> login(
      @Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
    final String fingerprint = fingerprintResolver.resolve(httpRequest).orElse(null);
    final SsoSession session =
        sessionManager.login(request.username(), request.password(), fingerprint);
    final UserRecord user = requireUser(session.subjectId());
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, cookieFactory.sessionCookie(session).toString())
        .body(UserResponse.from(user));
  }

  /** SSO セッションを破棄する。セッションが無くても 204。 */
  @PostMapping("/logout")
  public ResponseEntity<Void> logout(
      @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
    sessionManager.logout(sessionId);
    return ResponseEntity.noContent()
        .header(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString())
        .build();
  }

  @GetMapping("/me")
  public ResponseEntity<UserResponse> me(
      @CookieValue(name = SESSION_COOKIE, required = false) String sessionId) {
    final String subjectId = sessionManager.currentSubject(sessionId);
    return ResponseEntity.ok(UserResponse.from(requireUser(subjectId)));
  }

  @PostMapping("/password")
  public ResponseEntity<Void> changePassword(
      @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
      @Valid @RequestBody PasswordChangeRequest request) {
    final String subjectId = sessionManager.currentSubject(sessionId);
    credentialStore.updatePassword(subjectId, request.currentPassword(), request.newPassword());
    return ResponseEntity.noContent().build();
  }

  /** 現在提示しているクライアント証明書の fingerprint を利用者に束縛する。 */
  @PostMapping("/certificate")
  public ResponseEntity<UserResponse> bindCertificate(
      @CookieValue(name = SESSION_COOKIE, required = false) String sessionId,
      HttpServletRequest httpRequest) {
    final String subjectId = sessionManager.currentSubject(sessionId);
    final String fingerprint =
        fingerprintResolver
            .resolve(httpRequest)
            .orElseThrow(
                () ->
                    new SsoException(
                        SsoException.Reason.INVALID_REQUEST,
                        "client certificate is required"));
    return ResponseEntity.ok(
        UserResponse.from(credentialStore.bindFingerprint(subjectId, fingerprint)));
  }

  private UserRecord requireUser(String subjectId) {
    return credentialStore
        .findBySubject(subjectId)
        .orElseThrow(() -> new SsoException(SsoException.Reason.NO_SESSION, "login required"));
  }
}
