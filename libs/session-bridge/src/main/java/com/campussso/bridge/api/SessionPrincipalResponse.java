package com.campussso.bridge.api;

import com.campussso.bridge.model.SsoPrincipal;
import java.util.List;

public record SessionPrincipalResponse(String subject, String role, List<String> scopes) {

  public static SessionPrincipalResponse from(SsoPrincipal principal) {
    return new SessionPrincipalResponse(
        principal.subject(), principal.role(), principal.scopes().stream().sorted().toList());
  }
}
