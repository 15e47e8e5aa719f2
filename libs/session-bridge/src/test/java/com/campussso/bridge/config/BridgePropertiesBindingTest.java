package com.campussso.bridge.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class BridgePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsCloudSiteSettings() {
    contextRunner
        .withPropertyValues(
            "sso.bridge.client-id=cloud-api",
            "sso.bridge.client-secret=cloud-secret",
            "sso.bridge.redirect-uri=https://cloud.localhost:5002/session/callback",
            "sso.bridge.scope=files.read files.write",
            "sso.bridge.auth-server-base-url=https://sso.internal:5000",
            "sso.bridge.cookie-name=CLOUD_SESSION",
            "sso.bridge.cookie-secure=false",
            "sso.bridge.read-timeout=750ms",
            "sso.bridge.ssl-bundle=auth-server",
            "sso.bridge.retention.enabled=true",
            "sso.bridge.retention.cleanup-interval=30s")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final BridgeProperties properties = context.getBean(BridgeProperties.class);

              assertThat(properties.clientId()).isEqualTo("cloud-api");
              assertThat(properties.cookieName()).isEqualTo("CLOUD_SESSION");
              assertThat(properties.cookieSecure()).isFalse();
              assertThat(properties.readTimeout()).isEqualTo(Duration.ofMillis(750));
              assertThat(properties.sslBundle()).isEqualTo("auth-server");
              assertThat(properties.authorizeEndpoint())
                  .isEqualTo("https://sso.internal:5000/oauth/authorize");
              assertThat(properties.retention().enabled()).isTrue();
              assertThat(properties.retention().cleanupInterval())
                  .isEqualTo(Duration.ofSeconds(30));
              assertThat(properties.toString()).doesNotContain("cloud-secret");
            });
  }

  @Test
  void appliesDefaultsWhenUnset() {
    contextRunner.run(
        context -> {
          final BridgeProperties properties = context.getBean(BridgeProperties.class);

          assertThat(properties.tokenPath()).isEqualTo("/oauth/token");
          assertThat(properties.validatePath()).isEqualTo("/oauth/validate");
          assertThat(properties.revokePath()).isEqualTo("/oauth/revoke");
          assertThat(properties.cookieSecure()).isTrue();
          assertThat(properties.connectTimeout()).isEqualTo(Duration.ofSeconds(2));
          assertThat(properties.readTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(properties.stateTtl()).isEqualTo(Duration.ofMinutes(5));
          assertThat(properties.sslBundle()).isNull();
          assertThat(properties.failureRedirect()).isEqualTo("/?login_error=1");
          assertThat(properties.retention().enabled()).isFalse();
        });
  }

  @Configuration
  @EnableConfigurationProperties(BridgeProperties.class)
  static class TestConfiguration {}
}
