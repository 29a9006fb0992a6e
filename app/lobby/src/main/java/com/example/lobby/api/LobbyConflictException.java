/*
 * どこで: Lobby API
 * 何を: 状態の前提条件違反 (満員/開始済み/重複など) を表現する
 * なぜ: 呼び出し側が状態を変えてから再試行できる失敗を 409 へ正規化するため
 */
package com.example.lobby.api;

public class LobbyConflictException extends LobbyException {

  public LobbyConflictException(ApiErrorCode code, String entityId, String message) {
    super(code, entityId, message);
  }
}
