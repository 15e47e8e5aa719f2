/*
 * どこで: auth-server サービス層
 * 何を: プロトコル上の失敗理由を Reason で表す例外
 * なぜ: API 層で理由ごとに HTTP ステータスとエラーコードへ機械的に変換するため
 */
package com.campussso.authserver.service;

public class SsoException extends RuntimeException {

  public enum Reason {
    INVALID_REQUEST,
    INVALID_CREDENTIALS,
    CERTIFICATE_MISMATCH,
    NO_SESSION,
    UNKNOWN_CLIENT,
    REDIRECT_MISMATCH,
    INVALID_SCOPE,
    INVALID_CODE,
    CLIENT_AUTH_FAILED,
    TOKEN_EXPIRED,
    TOKEN_UNKNOWN,
    REFRESH_EXPIRED,
    REFRESH_UNKNOWN,
    REFRESH_REPLAYED,
    USER_EXISTS,
    FORBIDDEN
  }

  private final Reason reason;

  public SsoException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SsoException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
