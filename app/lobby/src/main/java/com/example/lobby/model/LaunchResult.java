/*
 * どこで: Lobby ドメインモデル
 * 何を: ルーム起動の結果 (クライアント入口と接続先) を表現する
 * なぜ: 呼び出し側がローカルで入口を実行するための情報を返すため
 */
package com.example.lobby.model;

import java.util.Optional;

public record LaunchResult(
    String roomId, String gameId, String version, String entryPoint, ConnectionInfo connection) {

  public Optional<ConnectionInfo> connectionInfo() {
    return Optional.ofNullable(connection);
  }
}
