package com.campussso.authserver.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sso.retention.enabled", havingValue = "true")
public class SsoRetentionWorker {

  private final SsoRetentionService retentionService;

  @Scheduled(fixedDelayString = "${sso.retention.cleanup-interval:PT1M}")
  public void run() {
    retentionService.cleanup();
  }
}
