/*
 * どこで: Lobby Repository 層
 * 何を: ゲーム/バージョンの永続化操作を抽象化する
 * なぜ: CatalogService を保存方式から切り離し、テストで差し替えられるようにするため
 */
package com.example.lobby.repository;

import com.example.lobby.model.GameRecord;
import java.util.List;
import java.util.Optional;

public interface GameCatalogRepository {

  /** 役割: ID でゲームを取得する。 動作: 掲載状態に関係なく返す。 前提: gameId は空でないこと。 */
  Optional<GameRecord> findById(String gameId);

  /** 役割: 全ゲームを作成順で返す。 動作: 下架済みも含む。絞り込みは呼び出し側で行う。 */
  List<GameRecord> findAll();

  /**
   * 役割: 新規ゲームを登録する。 動作: 同じ gameId が既にあれば登録せず false を返す。 前提: record は null でないこと。
   */
  boolean insertIfAbsent(GameRecord record);

  /** 役割: 既存ゲームを差し替える。 前提: 呼び出し側がゲーム単位のロックを保持していること。 */
  void save(GameRecord record);
}
