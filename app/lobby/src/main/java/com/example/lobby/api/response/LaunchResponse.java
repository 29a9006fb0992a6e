/*
 * どこで: Lobby API レスポンス DTO
 * 何を: ルーム開始の結果を返す
 * なぜ: クライアントが入口を実行し、必要なら game server へ接続するための情報を渡すため
 */
package com.example.lobby.api.response;

import com.example.lobby.model.LaunchResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LaunchResponse(
    String roomId, String gameId, String version, String entry, ConnectionResponse connection) {

  public static LaunchResponse from(LaunchResult result) {
    return new LaunchResponse(
        result.roomId(),
        result.gameId(),
        result.version(),
        result.entryPoint(),
        ConnectionResponse.from(result.connection()));
  }
}
