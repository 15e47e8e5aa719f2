/*
 * どこで: auth-server ドメインモデル
 * 何を: 利用者ロールを表す列挙型
 * なぜ: 検証結果としてリソースサーバーへ渡すロールを型安全に扱うため
 */
package com.campussso.authserver.model;

import java.util.Locale;

public enum UserRole {
  STUDENT,
  TEACHER,
  ADMIN;

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static UserRole fromWireValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("role is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("role is invalid", ex);
    }
  }
}
