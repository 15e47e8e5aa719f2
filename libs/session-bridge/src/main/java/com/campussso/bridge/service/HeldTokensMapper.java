package com.campussso.bridge.service;

import com.campussso.bridge.model.HeldTokens;
import com.campussso.bridge.service.dto.TokenSetResponse;
import java.time.Instant;

final class HeldTokensMapper {

  private HeldTokensMapper() {}

  static HeldTokens toHeldTokens(TokenSetResponse response, Instant receivedAt) {
    return new HeldTokens(
        response.accessToken(),
        response.refreshToken(),
        response.subject(),
        response.scope(),
        receivedAt.plusSeconds(response.expiresIn()),
        receivedAt.plusSeconds(response.refreshExpiresIn()));
  }
}
