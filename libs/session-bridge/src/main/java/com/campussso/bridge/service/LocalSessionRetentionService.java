package com.campussso.bridge.service;

import com.campussso.bridge.repository.LocalSessionRepository;
import com.campussso.bridge.repository.LoginStateRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LocalSessionRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(LocalSessionRetentionService.class);

  private final LocalSessionRepository localSessionRepository;
  private final LoginStateRepository loginStateRepository;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final int sessions = localSessionRepository.deleteExpired(now);
    final int states = loginStateRepository.deleteExpired(now);
    if (sessions + states > 0) {
      logger.info("local session retention removed sessions={} states={}", sessions, states);
    }
    return sessions + states;
  }
}
