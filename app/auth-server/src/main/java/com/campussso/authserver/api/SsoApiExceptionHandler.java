/*
 * どこで: auth-server API
 * 何を: SsoException と入力エラーを OAuth 形式のエラー応答へ変換する
 * なぜ: 失敗理由ごとの HTTP ステータスを固定し、トークン値や内部状態を応答に含めないため
 */
package com.campussso.authserver.api;

import com.campussso.authserver.service.SsoException;
import com.campussso.authserver.service.SsoMetrics;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class SsoApiExceptionHandler {

  private final SsoMetrics metrics;

  /**
   * 役割:
   * - SsoException の理由を HTTP ステータスと error コードへ写像する。
   *
   * 期待動作:
   * - refresh 系の失敗は理由を区別せず invalid_grant として返す。
   * - error_description は理由ごとの固定文言とし、例外メッセージは返さない。
   */
  @ExceptionHandler(SsoException.class)
  public ResponseEntity<ApiErrorResponse> handleSso(SsoException ex) {
    final String error =
        switch (ex.reason()) {
          case INVALID_REQUEST -> "invalid_request";
          case INVALID_CREDENTIALS -> "invalid_credentials";
          case CERTIFICATE_MISMATCH -> "certificate_mismatch";
          case NO_SESSION -> "login_required";
          case UNKNOWN_CLIENT, CLIENT_AUTH_FAILED -> "invalid_client";
          case REDIRECT_MISMATCH -> "redirect_uri_mismatch";
          case INVALID_SCOPE -> "invalid_scope";
          case INVALID_CODE, REFRESH_EXPIRED, REFRESH_UNKNOWN, REFRESH_REPLAYED -> "invalid_grant";
          case TOKEN_EXPIRED -> "token_expired";
          case TOKEN_UNKNOWN -> "invalid_token";
          case USER_EXISTS -> "user_exists";
          case FORBIDDEN -> "access_denied";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case INVALID_REQUEST,
              UNKNOWN_CLIENT,
              REDIRECT_MISMATCH,
              INVALID_SCOPE,
              INVALID_CODE,
              REFRESH_EXPIRED,
              REFRESH_UNKNOWN,
              REFRESH_REPLAYED -> HttpStatus.BAD_REQUEST;
          case INVALID_CREDENTIALS,
              CERTIFICATE_MISMATCH,
              NO_SESSION,
              CLIENT_AUTH_FAILED,
              TOKEN_EXPIRED,
              TOKEN_UNKNOWN -> HttpStatus.UNAUTHORIZED;
          case USER_EXISTS -> HttpStatus.CONFLICT;
          case FORBIDDEN -> HttpStatus.FORBIDDEN;
        };
    metrics.recordProtocolError(error);
    return error(status, error, describe(ex));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return invalidRequest(message);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return invalidRequest(ex.getParameterName() + " is required");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return invalidRequest("request body is required");
    }
    return invalidRequest("request body is invalid");
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException ex) {
    return invalidRequest("content type is not supported");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return invalidRequest(ex.getMessage());
  }

  private String describe(SsoException ex) {
    return switch (ex.reason()) {
      case INVALID_REQUEST, REDIRECT_MISMATCH, INVALID_SCOPE -> ex.getMessage();
      case INVALID_CREDENTIALS -> "username or password is incorrect";
      case CERTIFICATE_MISMATCH -> "client certificate does not match";
      case NO_SESSION -> "login required";
      case UNKNOWN_CLIENT -> "client is not registered";
      case CLIENT_AUTH_FAILED -> "client authentication failed";
      case INVALID_CODE -> "authorization code is invalid";
      case REFRESH_EXPIRED, REFRESH_UNKNOWN, REFRESH_REPLAYED -> "refresh token is invalid";
      case TOKEN_EXPIRED -> "access token expired";
      case TOKEN_UNKNOWN -> "access token is invalid";
      case USER_EXISTS -> "user already exists";
      case FORBIDDEN -> "access denied";
    };
  }

  private ResponseEntity<ApiErrorResponse> invalidRequest(String message) {
    metrics.recordProtocolError("invalid_request");
    return error(HttpStatus.BAD_REQUEST, "invalid_request", message);
  }

  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status)
        .cacheControl(CacheControl.noStore())
        .body(new ApiErrorResponse(error, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
