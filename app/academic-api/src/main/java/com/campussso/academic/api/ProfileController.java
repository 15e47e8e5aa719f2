package com.campussso.academic.api;

import com.campussso.bridge.model.SsoPrincipal;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 講義・成績 API が前提とする本人情報。検証は session bridge が済ませている。 */
@RestController
@RequestMapping("/v1")
public class ProfileController {

  private static final String SITE = "academic";

  @GetMapping("/me")
  public MeResponse me(@AuthenticationPrincipal SsoPrincipal principal) {
    return MeResponse.of(SITE, principal);
  }
}
