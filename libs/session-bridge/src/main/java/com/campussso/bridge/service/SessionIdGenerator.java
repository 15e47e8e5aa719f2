package com.campussso.bridge.service;

import java.security.SecureRandom;
import java.util.Base64;
import org.springframework.stereotype.Component;

/** ローカルセッション id と login state に使う推測不能な値。 */
@Component
public class SessionIdGenerator {

  private static final int ID_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  public String next() {
    final byte[] bytes = new byte[ID_BYTES];
    SECURE_RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
