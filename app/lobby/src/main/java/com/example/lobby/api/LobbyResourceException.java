/*
 * どこで: Lobby API
 * 何を: 外部資源 (プロセス起動/展開/保存) の失敗を表現する
 * なぜ: ロールバック済みで再試行可能な失敗を 503 として返すため
 */
package com.example.lobby.api;

public class LobbyResourceException extends LobbyException {

  public LobbyResourceException(ApiErrorCode code, String entityId, String message) {
    super(code, entityId, message);
  }

  public LobbyResourceException(
      ApiErrorCode code, String entityId, String message, Throwable cause) {
    super(code, entityId, message, cause);
  }

  public static LobbyResourceException launchFailed(String roomId, String reason, Throwable cause) {
    return new LobbyResourceException(
        ApiErrorCode.LAUNCH_FAILED, roomId, "launch failed: " + reason, cause);
  }

  public static LobbyResourceException uploadFailed(String gameId, Throwable cause) {
    return new LobbyResourceException(
        ApiErrorCode.UPLOAD_FAILED, gameId, "upload failed for " + gameId, cause);
  }
}
