package com.campussso.bridge.api;

import com.campussso.bridge.service.SessionCookieFactory;
import com.campussso.bridge.service.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** ブラウザには理由を区別しない「再ログイン」応答だけを返す。 */
@RestControllerAdvice
@RequiredArgsConstructor
public class BridgeApiExceptionHandler {

  private final SessionCookieFactory cookieFactory;

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnauthenticated(UnauthenticatedException ex) {
    final ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.UNAUTHORIZED);
    if (ex.sessionEnded()) {
      builder.header(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString());
    }
    return builder.body(new ApiErrorResponse("unauthenticated", "log in again"));
  }
}
