/*
 * どこで: 共通セキュリティユーティリティ
 * 何を: 秘密値の比較を一定時間で行う
 * なぜ: client_secret や証明書 fingerprint の推測にタイミング差を使わせないため
 */
package com.campussso.common.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class SecureCompare {
  private SecureCompare() {}

  public static boolean equals(String expected, String actual) {
    if (expected == null || actual == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
  }
}
