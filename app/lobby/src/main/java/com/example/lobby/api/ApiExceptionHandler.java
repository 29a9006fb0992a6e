/*
 * どこで: Lobby API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: エラー種別ごとのステータスと応答形状を統一するため
 */
package com.example.lobby.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(LobbyNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(LobbyNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, ex);
  }

  @ExceptionHandler(LobbyAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(LobbyAccessDeniedException ex) {
    return respond(HttpStatus.FORBIDDEN, ex);
  }

  @ExceptionHandler(LobbyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(LobbyConflictException ex) {
    return respond(HttpStatus.CONFLICT, ex);
  }

  @ExceptionHandler(InvalidLobbyRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidLobbyRequestException ex) {
    return respond(HttpStatus.BAD_REQUEST, ex);
  }

  @ExceptionHandler(LobbyResourceException.class)
  public ResponseEntity<ApiErrorResponse> handleResource(LobbyResourceException ex) {
    logger.warn("resource failure code={} entityId={}", ex.code(), ex.entityId(), ex);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, ex);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、取れなければ汎用文言へ寄せる。
    final String message =
        ex == null
            ? "request validation failed"
            : ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("request validation failed");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.VALIDATION_ERROR, message, null));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.BAD_REQUEST, ex.getHeaderName() + " is required", null));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない。
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, "request body is invalid", null));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled lobby failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, ex.getMessage(), null));
  }

  private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, LobbyException ex) {
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage(), ex.entityId()));
  }
}
