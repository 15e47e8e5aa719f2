package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** 起動時に設定の seed 利用者を登録する。既に存在する利用者はそのまま残す。 */
@Component
@RequiredArgsConstructor
public class SeedUserLoader implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(SeedUserLoader.class);

  private final SsoProperties properties;
  private final CredentialStore credentialStore;

  @Override
  public void run(ApplicationArguments args) {
    int created = 0;
    for (SsoProperties.SeedUser user : properties.users()) {
      if (credentialStore.findBySubject(user.username()).isPresent()) {
        continue;
      }
      credentialStore.register(
          user.username(), user.password(), user.role(), user.certFingerprint(), true);
      created++;
    }
    logger.info("seed users loaded created={} configured={}", created, properties.users().size());
  }
}
