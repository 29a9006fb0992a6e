/*
 * どこで: Lobby Repository 層
 * 何を: (player, game) ごとの起動記録の永続化を抽象化する
 * なぜ: 単調増加の upsert をキー単位で原子的に行う責務を保存方式側へ寄せるため
 */
package com.example.lobby.repository;

import com.example.lobby.model.PlayRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PlayRecordRepository {

  /**
   * 役割: 起動記録を 1 回分進める。
   * 動作: 記録が無ければ play_count=1 で作成し、あれば加算する。減算/削除の経路は持たない。
   * 前提: 同一 (playerId, gameId) に対する呼び出しは原子的に直列化されること。
   */
  PlayRecord recordStart(String playerId, String gameId, Instant startedAt);

  Optional<PlayRecord> find(String playerId, String gameId);

  List<PlayRecord> findByPlayer(String playerId);
}
