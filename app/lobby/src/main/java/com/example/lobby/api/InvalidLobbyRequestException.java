/*
 * どこで: Lobby API
 * 何を: リクエスト値の妥当性エラーを表現する
 * なぜ: 入力不備 (スコア範囲外/manifest 不正など) を 400 へ正規化するため
 */
package com.example.lobby.api;

public class InvalidLobbyRequestException extends LobbyException {

  public InvalidLobbyRequestException(String message) {
    super(ApiErrorCode.BAD_REQUEST, null, message);
  }

  public InvalidLobbyRequestException(ApiErrorCode code, String entityId, String message) {
    super(code, entityId, message);
  }

  public InvalidLobbyRequestException(
      ApiErrorCode code, String entityId, String message, Throwable cause) {
    super(code, entityId, message, cause);
  }
}
