/*
 * どこで: Lobby ドメインモデル
 * 何を: ルーム (固定バージョン/参加順の名簿/状態/接続先) を表現する
 * なぜ: ルーム単位のロック内でのみ差し替える不変スナップショットとして扱うため
 */
package com.example.lobby.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record RoomRecord(
    String roomId,
    String gameId,
    VersionRecord version,
    String hostPlayerId,
    List<String> roster,
    RoomStatus status,
    ConnectionInfo connection,
    Instant createdAt,
    Instant startedAt,
    Instant closedAt,
    String closedReason) {

  public RoomRecord {
    roster = roster == null ? List.of() : List.copyOf(roster);
  }

  public static RoomRecord waiting(
      String roomId, VersionRecord version, String hostPlayerId, Instant createdAt) {
    return new RoomRecord(
        roomId,
        version.gameId(),
        version,
        hostPlayerId,
        List.of(hostPlayerId),
        RoomStatus.WAITING,
        null,
        createdAt,
        null,
        null,
        null);
  }

  public GameManifest manifest() {
    return version.manifest();
  }

  public boolean hasMember(String playerId) {
    return roster.contains(playerId);
  }

  public boolean isHost(String playerId) {
    return hostPlayerId.equals(playerId);
  }

  public RoomRecord withPlayerAdded(String playerId) {
    final List<String> updated = new ArrayList<>(roster);
    updated.add(playerId);
    return withRoster(updated);
  }

  public RoomRecord withPlayerRemoved(String playerId) {
    final List<String> updated = new ArrayList<>(roster);
    updated.remove(playerId);
    return withRoster(updated);
  }

  public RoomRecord running(ConnectionInfo connection, Instant at) {
    return new RoomRecord(
        roomId,
        gameId,
        version,
        hostPlayerId,
        roster,
        RoomStatus.RUNNING,
        connection,
        createdAt,
        at,
        null,
        null);
  }

  public RoomRecord closed(String reason, Instant at) {
    return new RoomRecord(
        roomId,
        gameId,
        version,
        hostPlayerId,
        roster,
        RoomStatus.CLOSED,
        connection,
        createdAt,
        startedAt,
        at,
        reason);
  }

  private RoomRecord withRoster(List<String> updated) {
    return new RoomRecord(
        roomId,
        gameId,
        version,
        hostPlayerId,
        updated,
        status,
        connection,
        createdAt,
        startedAt,
        closedAt,
        closedReason);
  }
}
