package com.campussso.cloud.api;

import com.campussso.bridge.model.SsoPrincipal;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MeController {

  @GetMapping("/v1/me")
  public MeResponse me(@AuthenticationPrincipal SsoPrincipal principal) {
    return MeResponse.of("cloud", principal);
  }
}
