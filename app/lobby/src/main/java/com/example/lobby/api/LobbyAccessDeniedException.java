/*
 * どこで: Lobby API
 * 何を: 所有者/参加者でない操作を表現する
 * なぜ: 認可失敗を 403 へ正規化するため
 */
package com.example.lobby.api;

public class LobbyAccessDeniedException extends LobbyException {

  public LobbyAccessDeniedException(ApiErrorCode code, String entityId, String message) {
    super(code, entityId, message);
  }

  public static LobbyAccessDeniedException notOwner(String gameId, String developerId) {
    return new LobbyAccessDeniedException(
        ApiErrorCode.NOT_OWNER, gameId, "developer " + developerId + " does not own " + gameId);
  }

  public static LobbyAccessDeniedException notAuthorized(String roomId, String playerId) {
    return new LobbyAccessDeniedException(
        ApiErrorCode.NOT_AUTHORIZED,
        roomId,
        "player " + playerId + " is not authorized for room " + roomId);
  }
}
