/*
 * Where: auth-server service layer
 * What: Purges expired SSO sessions, authorization codes and token families
 * Why: Keep the in-memory stores bounded for long-running processes
 */
package com.campussso.authserver.service;

import com.campussso.authserver.repository.AuthorizationCodeRepository;
import com.campussso.authserver.repository.SsoSessionRepository;
import com.campussso.authserver.repository.TokenRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SsoRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(SsoRetentionService.class);

  private final SsoSessionRepository sessionRepository;
  private final AuthorizationCodeRepository codeRepository;
  private final TokenRepository tokenRepository;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final int deletedSessions = sessionRepository.deleteExpired(now);
    final int deletedCodes = codeRepository.deleteExpired(now);
    final int deletedTokens = tokenRepository.deleteExpired(now);
    logger.info(
        "sso retention cleanup deleted sessions={} codes={} tokenEntries={}",
        deletedSessions,
        deletedCodes,
        deletedTokens);
  }
}
