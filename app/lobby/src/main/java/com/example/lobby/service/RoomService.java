/*
 * どこで: Lobby サービス層
 * 何を: ルームの作成/参加/退出/終了と一覧を扱う
 * なぜ: 名簿と状態の更新をルーム単位のロック内に閉じ、満員やバージョン固定を保証するため
 */
package com.example.lobby.service;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.LobbyAccessDeniedException;
import com.example.lobby.api.LobbyConflictException;
import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.config.LobbyRoomProperties;
import com.example.lobby.model.AccountRole;
import com.example.lobby.model.GameRecord;
import com.example.lobby.model.RoomRecord;
import com.example.lobby.model.RoomStatus;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.repository.RoomRepository;
import com.example.lobby.runtime.GameProcess;
import com.example.lobby.runtime.GameServerRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RoomService {

  static final String REASON_CLOSED_BY_HOST = "closed-by-host";
  static final String REASON_EMPTY = "empty";
  static final String REASON_PROCESS_EXIT = "process-exit";
  static final String REASON_HOST_TIMEOUT = "host-timeout";
  static final String REASON_PLAYER_TIMEOUT = "player-timeout";

  private static final Logger logger = LoggerFactory.getLogger(RoomService.class);

  private final RoomRepository roomRepository;
  private final CatalogService catalogService;
  private final VersionResolver versionResolver;
  private final GameServerRegistry gameServerRegistry;
  private final RoomEventNotifier roomEventNotifier;
  private final RoomHeartbeatTracker heartbeatTracker;
  private final AccountDirectory accountDirectory;
  private final LobbyRoomProperties properties;
  private final LobbyMetrics metrics;
  private final EntityLocks entityLocks;
  private final Clock clock;

  /**
   * 役割: ルームを作成し、作成者をホストとして名簿に入れる。
   * 動作: バージョンは作成時点で固定する。ラベル省略時はその時点の最新を使う。
   * 前提: 下架済みのゲームには新しいルームを作れない。
   */
  public RoomRecord createRoom(String hostPlayerId, String gameId, String versionLabel) {
    accountDirectory.touch(hostPlayerId, AccountRole.PLAYER);
    final GameRecord game = catalogService.getGame(gameId);
    if (!game.isListed()) {
      throw new LobbyConflictException(
          ApiErrorCode.GAME_DELISTED, gameId, "game is delisted: " + gameId);
    }
    final VersionRecord version = versionResolver.resolve(game, versionLabel);
    if (!version.manifest().hasEntry()) {
      throw new LobbyConflictException(
          ApiErrorCode.GAME_NOT_PLAYABLE,
          gameId + "@" + version.label(),
          "version has no client entry: " + version.label());
    }
    if (!properties.hasRoomLimit()) {
      return openRoom(hostPlayerId, version);
    }
    // 上限判定と登録の間に別の作成が割り込まないよう、作成だけを直列化する。
    return entityLocks.withLock(
        EntityLocks.SCOPE_REGISTRY,
        "rooms",
        () -> {
          if (countOpenRooms() >= properties.maxOpenRooms()) {
            throw new LobbyConflictException(
                ApiErrorCode.ROOM_LIMIT_REACHED,
                null,
                "open room limit reached: " + properties.maxOpenRooms());
          }
          return openRoom(hostPlayerId, version);
        });
  }

  public RoomRecord joinRoom(String roomId, String playerId) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_ROOM,
        roomId,
        () -> {
          final RoomRecord room = requireRoom(roomId);
          if (room.status() != RoomStatus.WAITING) {
            throw new LobbyConflictException(
                ApiErrorCode.ROOM_CLOSED, roomId, "room is not accepting players: " + roomId);
          }
          if (room.hasMember(playerId)) {
            throw new LobbyConflictException(
                ApiErrorCode.ALREADY_JOINED, roomId, "player already joined: " + playerId);
          }
          if (room.roster().size() >= room.manifest().maxPlayers()) {
            throw new LobbyConflictException(ApiErrorCode.ROOM_FULL, roomId, "room is full: " + roomId);
          }
          final RoomRecord joined = room.withPlayerAdded(playerId);
          roomRepository.save(joined);
          heartbeatTracker.touch(roomId, playerId, Instant.now(clock));
          logger.info(
              "player joined roomId={} playerId={} roster={}",
              roomId,
              playerId,
              joined.roster().size());
          return joined;
        });
  }

  /**
   * 役割: 名簿からプレイヤーを外す。
   * 動作: 名簿にいなければ何もしない。WAITING で名簿が空になったルームは閉じる。CLOSED では何もしない。
   */
  public RoomRecord leaveRoom(String roomId, String playerId) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_ROOM,
        roomId,
        () -> {
          final RoomRecord room = requireRoom(roomId);
          if (room.status() == RoomStatus.CLOSED || !room.hasMember(playerId)) {
            return room;
          }
          final RoomRecord left = room.withPlayerRemoved(playerId);
          heartbeatTracker.remove(roomId, playerId);
          if (left.status() == RoomStatus.WAITING && left.roster().isEmpty()) {
            return closeLocked(left, REASON_EMPTY);
          }
          roomRepository.save(left);
          logger.info("player left roomId={} playerId={}", roomId, playerId);
          return left;
        });
  }

  /**
   * 役割: ホストの要求でルームを閉じる。
   * 動作: 既に CLOSED なら何もしない。起動中の game server は停止する。
   */
  public RoomRecord closeRoom(String roomId, String requesterId) {
    accountDirectory.touch(requesterId, AccountRole.PLAYER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_ROOM,
        roomId,
        () -> {
          final RoomRecord room = requireRoom(roomId);
          if (!room.isHost(requesterId)) {
            throw LobbyAccessDeniedException.notAuthorized(roomId, requesterId);
          }
          if (room.status() == RoomStatus.CLOSED) {
            return room;
          }
          return closeLocked(room, REASON_CLOSED_BY_HOST);
        });
  }

  /**
   * 役割: game server プロセスの終了に合わせてルームを閉じる。
   * 動作: 終了したのがそのルームの現在のプロセスで、ルームが RUNNING の場合だけ閉じる。
   */
  public void closeOnProcessExit(String roomId, GameProcess process, int exitCode) {
    entityLocks.withLock(
        EntityLocks.SCOPE_ROOM,
        roomId,
        () -> {
          final RoomRecord room = roomRepository.findById(roomId).orElse(null);
          if (room == null
              || room.status() != RoomStatus.RUNNING
              || !gameServerRegistry.isCurrent(roomId, process)) {
            logger.debug("ignored stale process exit roomId={} exitCode={}", roomId, exitCode);
            return null;
          }
          logger.info("game server exited roomId={} exitCode={}", roomId, exitCode);
          return closeLocked(room, REASON_PROCESS_EXIT);
        });
  }

  /**
   * 役割: 名簿メンバーの生存通知を記録する。
   * 動作: 名簿にいなければ NOT_AUTHORIZED、CLOSED なら ROOM_CLOSED を返す。
   */
  public RoomRecord heartbeat(String roomId, String playerId) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_ROOM,
        roomId,
        () -> {
          final RoomRecord room = requireRoom(roomId);
          if (!room.hasMember(playerId)) {
            throw LobbyAccessDeniedException.notAuthorized(roomId, playerId);
          }
          if (room.status() == RoomStatus.CLOSED) {
            throw new LobbyConflictException(
                ApiErrorCode.ROOM_CLOSED, roomId, "room is closed: " + roomId);
          }
          heartbeatTracker.touch(roomId, playerId, Instant.now(clock));
          return room;
        });
  }

  /**
   * 役割: heartbeat の途絶えたプレイヤーを処理する。
   * 動作: WAITING ではホストが途絶えたらルームを閉じ、それ以外の途絶えたメンバーは名簿から外す。RUNNING では誰か 1 人でも途絶えたら閉じる。
   * 閉じたルーム数を返す。期限が未設定なら何もしない。
   */
  public int closeStaleRooms() {
    if (!properties.hasHeartbeatTimeout()) {
      return 0;
    }
    final Instant cutoff = Instant.now(clock).minus(properties.heartbeatTimeout());
    int closed = 0;
    for (RoomRecord candidate : listOpenRooms()) {
      final String roomId = candidate.roomId();
      final Boolean closedNow =
          entityLocks.withLock(
              EntityLocks.SCOPE_ROOM, roomId, () -> expireStalePlayers(roomId, cutoff));
      if (Boolean.TRUE.equals(closedNow)) {
        closed++;
      }
    }
    return closed;
  }

  public RoomRecord getRoom(String roomId) {
    return requireRoom(roomId);
  }

  /** 役割: WAITING/RUNNING のルームを採番順で返す。 */
  public List<RoomRecord> listOpenRooms() {
    return roomRepository.findAll().stream()
        .filter(room -> room.status() != RoomStatus.CLOSED)
        .toList();
  }

  /** 役割: 保持期間を過ぎた CLOSED ルームを削除する。 動作: 削除件数を返す。 */
  public int purgeClosedRooms() {
    final Instant cutoff = Instant.now(clock).minus(properties.closedRetention());
    final List<String> removed = roomRepository.deleteClosedBefore(cutoff);
    if (!removed.isEmpty()) {
      logger.info("purged closed rooms count={}", removed.size());
    }
    return removed.size();
  }

  /** SessionLauncher から遷移後に呼ばれ、open ルーム数のゲージを更新する。 */
  void refreshOpenRoomGauge() {
    metrics.updateOpenRooms(countOpenRooms());
  }

  private boolean expireStalePlayers(String roomId, Instant cutoff) {
    final RoomRecord room = roomRepository.findById(roomId).orElse(null);
    if (room == null || room.status() == RoomStatus.CLOSED) {
      return false;
    }
    final List<String> stale = heartbeatTracker.stalePlayers(room, cutoff);
    if (stale.isEmpty()) {
      return false;
    }
    if (room.status() == RoomStatus.RUNNING) {
      logger.info("players timed out in running room roomId={} players={}", roomId, stale);
      closeLocked(room, REASON_PLAYER_TIMEOUT);
      return true;
    }
    if (stale.contains(room.hostPlayerId())) {
      logger.info("host timed out roomId={} host={}", roomId, room.hostPlayerId());
      closeLocked(room, REASON_HOST_TIMEOUT);
      return true;
    }
    RoomRecord trimmed = room;
    for (String playerId : stale) {
      trimmed = trimmed.withPlayerRemoved(playerId);
      heartbeatTracker.remove(roomId, playerId);
    }
    roomRepository.save(trimmed);
    logger.info("removed timed out players roomId={} players={}", roomId, stale);
    return false;
  }

  private RoomRecord openRoom(String hostPlayerId, VersionRecord version) {
    final Instant now = Instant.now(clock);
    final RoomRecord room =
        RoomRecord.waiting(roomRepository.nextRoomId(), version, hostPlayerId, now);
    roomRepository.save(room);
    heartbeatTracker.touch(room.roomId(), hostPlayerId, now);
    metrics.recordRoomTransition("created");
    refreshOpenRoomGauge();
    logger.info(
        "room created roomId={} gameId={} version={} host={}",
        room.roomId(),
        room.gameId(),
        version.label(),
        hostPlayerId);
    return room;
  }

  private RoomRecord closeLocked(RoomRecord room, String reason) {
    final RoomRecord closed = room.closed(reason, Instant.now(clock));
    roomRepository.save(closed);
    heartbeatTracker.forget(room.roomId());
    gameServerRegistry.stop(room.roomId());
    metrics.recordRoomTransition("closed");
    refreshOpenRoomGauge();
    logger.info("room closed roomId={} reason={}", room.roomId(), reason);
    roomEventNotifier.roomClosed(closed);
    return closed;
  }

  private long countOpenRooms() {
    return roomRepository.findAll().stream()
        .filter(room -> room.status() != RoomStatus.CLOSED)
        .count();
  }

  private RoomRecord requireRoom(String roomId) {
    return roomRepository.findById(roomId).orElseThrow(() -> LobbyNotFoundException.room(roomId));
  }
}
