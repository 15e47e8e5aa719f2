package com.campussso.bridge.service;

/** ローカルセッションから有効な本人を確定できなかった。ブラウザには再ログインだけを促す。 */
public class UnauthenticatedException extends RuntimeException {

  private final boolean sessionEnded;

  public UnauthenticatedException(String message) {
    this(message, true, null);
  }

  public UnauthenticatedException(String message, boolean sessionEnded, Throwable cause) {
    super(message, cause);
    this.sessionEnded = sessionEnded;
  }

  /** false の場合はローカルセッションが残っており、IdP 復旧後に再利用できる。 */
  public boolean sessionEnded() {
    return sessionEnded;
  }
}
