/*
 * どこで: Lobby ドメインモデル
 * 何を: (player, game) ごとの起動済み記録を表現する
 * なぜ: 評価資格を単調な記録 (play_count > 0) として扱うため
 */
package com.example.lobby.model;

import java.time.Instant;

public record PlayRecord(String playerId, String gameId, long playCount, Instant lastStartedAt) {

  public boolean hasStarted() {
    return playCount > 0;
  }
}
