package com.campussso.cloud.api;

import com.campussso.bridge.model.SsoPrincipal;
import java.util.List;

public record MeResponse(String site, String subject, String role, List<String> scopes) {

  static MeResponse of(String site, SsoPrincipal principal) {
    return new MeResponse(
        site, principal.subject(), principal.role(), principal.scopes().stream().sorted().toList());
  }
}
