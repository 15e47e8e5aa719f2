package com.campussso.authserver.api;

import com.campussso.authserver.api.response.CertificateBindingResponse;
import com.campussso.authserver.model.UserRecord;
import com.campussso.authserver.model.UserRole;
import com.campussso.authserver.service.CredentialStore;
import com.campussso.authserver.service.SessionManager;
import com.campussso.authserver.service.SsoException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

  private final SessionManager sessionManager;
  private final CredentialStore credentialStore;

  /** 証明書を束縛済みの利用者一覧。admin の SSO セッションが必要。 */
  @GetMapping("/certificates")
  public List<CertificateBindingResponse> certificates(
      @CookieValue(name = AuthController.SESSION_COOKIE, required = false) String sessionId) {
    final String subjectId = sessionManager.currentSubject(sessionId);
    final UserRecord caller =
        credentialStore
            .findBySubject(subjectId)
            .orElseThrow(() -> new SsoException(SsoException.Reason.NO_SESSION, "login required"));
    if (caller.role() != UserRole.ADMIN) {
      throw new SsoException(SsoException.Reason.FORBIDDEN, "admin role is required");
    }
    return credentialStore.listBoundCertificates().stream()
        .map(CertificateBindingResponse::from)
        .toList();
  }
}
