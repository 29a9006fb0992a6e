/*
 * どこで: Lobby Repository 層
 * 何を: ルームの保持/採番/削除を抽象化する
 * なぜ: ルームのライフサイクル管理を RoomService に閉じ、保存方式を差し替え可能にするため
 */
package com.example.lobby.repository;

import com.example.lobby.model.RoomRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RoomRepository {

  /** 役割: プロセス存続中に一意なルーム ID を採番する。 */
  String nextRoomId();

  Optional<RoomRecord> findById(String roomId);

  /** 役割: 全ルームを ID の採番順で返す。 動作: CLOSED も含む。 */
  List<RoomRecord> findAll();

  /** 前提: 呼び出し側がルーム単位のロックを保持していること。 */
  void save(RoomRecord room);

  /** 役割: CLOSED かつ cutoff 以前に閉じたルームを削除する。 動作: 削除したルーム ID を返す。 */
  List<String> deleteClosedBefore(Instant cutoff);
}
