/*
 * どこで: Lobby API
 * 何を: ドメイン例外の基底 (エラー種別 + 対象エンティティ ID) を定義する
 * なぜ: どの層で投げても ApiExceptionHandler が同じ形で応答できるようにするため
 */
package com.example.lobby.api;

public abstract class LobbyException extends RuntimeException {

  private final ApiErrorCode code;
  private final String entityId;

  protected LobbyException(ApiErrorCode code, String entityId, String message) {
    super(message);
    this.code = code;
    this.entityId = entityId;
  }

  protected LobbyException(ApiErrorCode code, String entityId, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.entityId = entityId;
  }

  public ApiErrorCode code() {
    return code;
  }

  public String entityId() {
    return entityId;
  }
}
