/*
 * どこで: Lobby Repository 層
 * 何を: 評価の upsert と取得を抽象化する
 * なぜ: (player, game) ごとに 1 件だけ保持する last-write-wins を保存方式側で保証するため
 */
package com.example.lobby.repository;

import com.example.lobby.model.RatingRecord;
import java.util.List;
import java.util.Optional;

public interface RatingRepository {

  /**
   * 役割: 評価を保存する。 動作: 同じ (playerId, gameId) の評価があれば上書きし、以前の値を返す。 前提: rating は null でないこと。
   */
  Optional<RatingRecord> upsert(RatingRecord rating);

  Optional<RatingRecord> find(String playerId, String gameId);

  /** 役割: ゲームの評価一覧を返す。 動作: 評価日時の新しい順。 */
  List<RatingRecord> findByGame(String gameId);
}
