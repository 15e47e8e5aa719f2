package com.campussso.authserver.service;

import com.campussso.authserver.model.CodeRedemption;
import com.campussso.authserver.model.TokenIntrospection;
import com.campussso.authserver.model.TokenPair;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** token endpoint の grant ごとの手順。client 認証を先に行い、Token Service へ委譲する。 */
@Service
@RequiredArgsConstructor
public class TokenGrantService {

  public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  public static final String GRANT_REFRESH_TOKEN = "refresh_token";

  private final AuthorizationCodeIssuer codeIssuer;
  private final ClientRegistry clientRegistry;
  private final TokenService tokenService;
  private final SsoMetrics metrics;

  public TokenPair exchangeCode(
      String code, String clientId, String clientSecret, String redirectUri) {
    final CodeRedemption redemption = codeIssuer.redeem(code, clientId, clientSecret, redirectUri);
    final TokenPair pair =
        tokenService.issueTokens(
            redemption.subjectId(),
            redemption.clientId(),
            redemption.scope(),
            redemption.certificateFingerprint());
    metrics.recordTokenIssued(GRANT_AUTHORIZATION_CODE);
    return pair;
  }

  public TokenPair refresh(String refreshToken, String clientId, String clientSecret) {
    clientRegistry.authenticate(clientId, clientSecret);
    final TokenPair pair = tokenService.refresh(refreshToken, clientId);
    metrics.recordTokenIssued(GRANT_REFRESH_TOKEN);
    return pair;
  }

  public TokenIntrospection validate(String accessToken, String presentedFingerprint) {
    return tokenService.validate(accessToken, presentedFingerprint);
  }

  public void revoke(String token, String clientId, String clientSecret) {
    clientRegistry.authenticate(clientId, clientSecret);
    tokenService.revoke(token, clientId);
  }
}
