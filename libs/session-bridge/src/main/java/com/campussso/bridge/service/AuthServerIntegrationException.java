/*
 * どこで: session bridge サービス層
 * 何を: IdP の back-channel 呼び出し失敗を表現する
 * なぜ: 期限切れだけを refresh 対象にし、それ以外はすべて fail closed で扱うため
 */
package com.campussso.bridge.service;

public class AuthServerIntegrationException extends RuntimeException {

  public enum Reason {
    TOKEN_EXPIRED,
    REJECTED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public AuthServerIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthServerIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
