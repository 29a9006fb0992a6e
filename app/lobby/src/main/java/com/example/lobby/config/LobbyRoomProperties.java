/*
 * どこで: Lobby 設定
 * 何を: ルーム数上限、CLOSED ルームの保持/掃除間隔、プレイヤーの heartbeat 期限を保持する
 * なぜ: 運用負荷に合わせてルーム管理の閾値を外から調整するため
 */
package com.example.lobby.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lobby.room")
public record LobbyRoomProperties(
    int maxOpenRooms,
    Duration closedRetention,
    Duration reaperInterval,
    boolean reaperEnabled,
    Duration heartbeatTimeout) {

  public boolean hasRoomLimit() {
    return maxOpenRooms > 0;
  }

  /** 0 または未設定なら heartbeat 切れによる退出/終了を行わない。 */
  public boolean hasHeartbeatTimeout() {
    return heartbeatTimeout != null && !heartbeatTimeout.isZero() && !heartbeatTimeout.isNegative();
  }
}
