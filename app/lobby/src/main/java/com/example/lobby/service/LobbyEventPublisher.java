/*
 * どこで: Lobby サービス層
 * 何を: ルームのライフサイクルイベント publish を抽象化する
 * なぜ: NATS 有効/無効で実装を切り替え、サービスからは同じ呼び出しにするため
 */
package com.example.lobby.service;

import com.example.lobby.model.RoomRecord;

public interface LobbyEventPublisher {

  String EVENT_ROOM_STARTED = "ROOM_STARTED";
  String EVENT_ROOM_CLOSED = "ROOM_CLOSED";

  /** 役割: ルームの起動/終了を通知する。 動作: 失敗時は IllegalStateException を送出する。 */
  void publish(String eventType, RoomRecord room);
}
