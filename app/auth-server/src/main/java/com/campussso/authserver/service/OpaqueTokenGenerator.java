package com.campussso.authserver.service;

import java.security.SecureRandom;
import java.util.Base64;
import org.springframework.stereotype.Component;

/** セッション id・認可コード・トークンに使う推測不能な不透明値を生成する。 */
@Component
public class OpaqueTokenGenerator {

  private static final int TOKEN_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  public String next() {
    final byte[] bytes = new byte[TOKEN_BYTES];
    SECURE_RANDOM.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }
}
