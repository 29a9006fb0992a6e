/*
 * どこで: Lobby サービス層
 * 何を: ルームごとにプレイヤーの最終 heartbeat 時刻を保持する
 * なぜ: 応答のなくなったプレイヤーを名簿から外し、ホスト不在や対戦中の切断でルームを閉じるため
 */
package com.example.lobby.service;

import com.example.lobby.model.RoomRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class RoomHeartbeatTracker {

  private final ConcurrentMap<String, ConcurrentMap<String, Instant>> beatsByRoom =
      new ConcurrentHashMap<>();

  public void touch(String roomId, String playerId, Instant at) {
    beatsByRoom.computeIfAbsent(roomId, ignored -> new ConcurrentHashMap<>()).put(playerId, at);
  }

  public void remove(String roomId, String playerId) {
    final Map<String, Instant> beats = beatsByRoom.get(roomId);
    if (beats != null) {
      beats.remove(playerId);
    }
  }

  public void forget(String roomId) {
    beatsByRoom.remove(roomId);
  }

  /**
   * 役割: cutoff より前から heartbeat のない名簿メンバーを参加順で返す。
   * 動作: 一度も記録のないメンバーはルーム作成時刻を最終 heartbeat とみなす。
   */
  public List<String> stalePlayers(RoomRecord room, Instant cutoff) {
    final Map<String, Instant> beats = beatsByRoom.get(room.roomId());
    return room.roster().stream()
        .filter(playerId -> lastBeat(beats, playerId, room.createdAt()).isBefore(cutoff))
        .toList();
  }

  private static Instant lastBeat(Map<String, Instant> beats, String playerId, Instant fallback) {
    if (beats == null) {
      return fallback;
    }
    return beats.getOrDefault(playerId, fallback);
  }
}
