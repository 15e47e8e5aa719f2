package com.campussso.bridge.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sso.bridge.retention.enabled", havingValue = "true")
public class LocalSessionRetentionWorker {

  private final LocalSessionRetentionService retentionService;

  @Scheduled(fixedDelayString = "${sso.bridge.retention.cleanup-interval:PT1M}")
  public void run() {
    retentionService.cleanup();
  }
}
