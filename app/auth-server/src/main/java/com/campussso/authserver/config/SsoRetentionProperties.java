package com.campussso.authserver.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sso.retention")
public record SsoRetentionProperties(boolean enabled, Duration cleanupInterval) {

  public SsoRetentionProperties {
    cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(1) : cleanupInterval;
  }
}
